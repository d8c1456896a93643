package com.webtext.core.service.export;

import com.webtext.core.util.UrlValidator;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 결과 파일명: {index}-{host}-{hash8}.txt
 * 같은 (index, url)은 항상 같은 이름, index가 다르면 항상 다른 이름.
 */
public final class OutputNamer {

    public static final String FILE_SUFFIX = ".txt";
    static final String UNKNOWN_HOST = "unknown-host";
    private static final int HASH_LEN = 8;

    private OutputNamer() {}

    public static String name(int index, String url) {
        return index + "-" + host(url) + "-" + shortHash(url) + FILE_SUFFIX;
    }

    /** URL 문자열(UTF-8)의 MD5 앞 8자리 */
    static String shortHash(String url) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(String.valueOf(url).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_LEN);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /** host[:port]. user-info 제거, ':'는 '_'로 치환 */
    static String host(String url) {
        URI u = UrlValidator.toUri(url);
        String auth = (u == null) ? null : u.getRawAuthority();
        if (auth == null || auth.isBlank()) return UNKNOWN_HOST;
        int at = auth.lastIndexOf('@');
        if (at >= 0) auth = auth.substring(at + 1);
        String h = auth.toLowerCase(Locale.ROOT).replace(':', '_').replaceAll("[\\\\/\\[\\]]", "");
        return h.isEmpty() ? UNKNOWN_HOST : h;
    }
}
