package com.webtext.core.model;

import java.nio.file.Path;

/**
 * 항목 하나의 처리 결과. 실패도 예외가 아니라 값으로 돌려준다(배치는 항상 계속 진행).
 *
 * @param text       추출 텍스트(실패 시 "")
 * @param outputFile 기록한 파일(아직 쓰기 전이거나 쓰기 실패면 null)
 * @param failure    null이면 성공
 * @param httpStatus 응답 코드(연결 실패면 -1)
 * @param retries    연결 재시도 횟수
 */
public record ItemResult(int index,
                         String url,
                         String text,
                         Path outputFile,
                         FailureKind failure,
                         String reason,
                         int httpStatus,
                         int retries) {

    public ItemResult {
        text = (text == null) ? "" : text;
    }

    public static ItemResult success(int index, String url, String text, int httpStatus, int retries) {
        return new ItemResult(index, url, text, null, null, null, httpStatus, retries);
    }

    public static ItemResult failure(int index, String url, FailureKind kind, String reason,
                                     int httpStatus, int retries) {
        return new ItemResult(index, url, "", null, kind, reason, httpStatus, retries);
    }

    public boolean isSuccess() { return failure == null; }

    public ItemResult withOutputFile(Path file) {
        return new ItemResult(index, url, text, file, failure, reason, httpStatus, retries);
    }

    /** 쓰기 실패로 전환. 추출 텍스트는 버린다. */
    public ItemResult withWriteFailure(String why) {
        return new ItemResult(index, url, "", null, FailureKind.WRITE, why, httpStatus, retries);
    }
}
