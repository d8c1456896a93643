package com.webtext.core.api;

import com.webtext.core.model.ExtractedDocument;

/** 원본 바이트에서 제목 + 본문 영역을 골라낸다. 엔진 오류는 런타임 예외로 올라온다. */
public interface IContentExtractor {
    ExtractedDocument extract(byte[] raw, String contentType, String baseUri);
}
