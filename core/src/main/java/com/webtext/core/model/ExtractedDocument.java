package com.webtext.core.model;

/**
 * 리더빌리티 추출 결과. body는 본문 영역의 HTML 조각(정제 전).
 */
public record ExtractedDocument(String title, String body) {

    public static final ExtractedDocument EMPTY = new ExtractedDocument("", "");

    public ExtractedDocument {
        title = (title == null) ? "" : title;
        body = (body == null) ? "" : body;
    }

    /** 제목과 본문을 줄바꿈 하나로 이어 붙인다. */
    public String joined() {
        return title + "\n" + body;
    }
}
