package com.webtext.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

/**
 * 절대 URL 판정 필터. 어떤 입력에도 예외를 던지지 않는다.
 * 브라우저처럼 관대하게 읽는다: 공백, |, {, }, ^ 처럼 java.net.URI가 거부하는 문자는
 * 퍼센트 인코딩한 뒤 파싱한다.
 */
public final class UrlValidator {
    private UrlValidator() {}

    /** URI 문법상 그대로 둘 수 없는 ASCII 문자 */
    private static final String ILLEGAL = " \"<>\\^`{|}";

    /** scheme과 host(또는 registry authority)가 모두 비어있지 않으면 true */
    public static boolean isValid(String candidate) {
        URI u = toUri(candidate);
        return u != null && notBlank(u.getScheme()) && notBlank(hostOf(u));
    }

    /**
     * trim + 관대한 인코딩 후 URI로. 파싱할 수 없으면 null.
     * 요청과 파일명은 모두 이 결과를 쓴다.
     */
    public static URI toUri(String candidate) {
        if (candidate == null) return null;
        String s = candidate.trim();
        if (s.isEmpty()) return null;
        try {
            return new URI(encodeLenient(s));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** host가 파싱되지 않으면(언더스코어 포함 호스트 등) authority에서 user-info/port를 떼어 쓴다. */
    static String hostOf(URI u) {
        if (u.getHost() != null) return u.getHost();
        String auth = u.getRawAuthority();
        if (auth == null) return null;
        int at = auth.lastIndexOf('@');
        if (at >= 0) auth = auth.substring(at + 1);
        int colon = auth.lastIndexOf(':');
        if (colon >= 0 && !auth.endsWith("]")) auth = auth.substring(0, colon);
        return auth;
    }

    /**
     * 금지 ASCII 문자, 제어 문자, 짝 없는 '%', 두 번째 이후의 '#'를 인코딩.
     * 비ASCII 문자는 authority 뒤(경로/쿼리/프래그먼트)에서만 UTF-8로 인코딩한다.
     */
    static String encodeLenient(String s) {
        int authorityEnd = authorityEnd(s);
        StringBuilder sb = new StringBuilder(s.length() + 16);
        boolean fragment = false;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            int len = Character.charCount(cp);
            if (cp == '%') {
                if (i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) sb.append('%');
                else sb.append("%25");
            } else if (cp == '#') {
                sb.append(fragment ? "%23" : "#");
                fragment = true;
            } else if (cp < 0x20 || cp == 0x7F || ILLEGAL.indexOf(cp) >= 0) {
                escape(sb, String.valueOf((char) cp));
            } else if (cp > 0x7F && i >= authorityEnd) {
                escape(sb, s.substring(i, i + len));
            } else {
                sb.appendCodePoint(cp);
            }
            i += len;
        }
        return sb.toString();
    }

    /** "scheme://" 뒤 authority가 끝나는 위치. authority가 없으면 0. */
    private static int authorityEnd(String s) {
        int start = s.indexOf("://");
        if (start < 0) return 0;
        start += 3;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' || c == '?' || c == '#') return i;
        }
        return s.length();
    }

    private static void escape(StringBuilder sb, String chars) {
        for (byte b : chars.getBytes(StandardCharsets.UTF_8)) {
            sb.append('%').append(Character.toUpperCase(Character.forDigit((b >> 4) & 0xF, 16)))
                    .append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
        }
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
