package com.webtext.core.service;

/** 네트워크 작업 전에 걸러내는 치명적 설정 오류. 실행을 즉시 중단한다. */
public class PreflightException extends Exception {
    public PreflightException(String message) {
        super(message);
    }

    public PreflightException(String message, Throwable cause) {
        super(message, cause);
    }
}
