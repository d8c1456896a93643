package com.webtext.core.model;

/** 항목 단위(복구 가능) 실패 분류 */
public enum FailureKind {
    /** 연결 수립 실패(거부/연결 타임아웃/호스트 미해결). 재시도 대상. */
    CONNECT,
    /** 응답 대기 타임아웃 */
    TIMEOUT,
    /** 그 밖의 I/O 오류 */
    NETWORK,
    /** 3xx. 따라가지 않음 */
    REDIRECT,
    /** 4xx/5xx */
    HTTP_STATUS,
    /** 본문 추출 엔진 오류 */
    EXTRACTION,
    /** 결과 파일 쓰기 실패 */
    WRITE
}
