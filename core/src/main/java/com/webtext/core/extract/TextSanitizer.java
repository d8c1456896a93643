package com.webtext.core.extract;

import org.jsoup.parser.Parser;

import java.util.regex.Pattern;

/** 남은 태그 제거 + HTML 엔티티 디코딩 */
public final class TextSanitizer {

    /** 비탐욕 태그 매칭. 한 줄 안의 <...>만 지운다. */
    private static final Pattern TAG = Pattern.compile("<.*?>");
    private static final Pattern TRAILING_WS = Pattern.compile("[ \\t\\x0B\\f]+(?=\\n)");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");

    private TextSanitizer() {}

    public static String clean(String html) {
        if (html == null || html.isEmpty()) return "";
        String text = TAG.matcher(html).replaceAll("");
        text = Parser.unescapeEntities(text, false);
        text = text.replace('\u00A0', ' ');
        text = TRAILING_WS.matcher(text).replaceAll("");
        text = BLANK_RUNS.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
