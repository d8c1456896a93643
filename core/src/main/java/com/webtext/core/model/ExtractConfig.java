package com.webtext.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 추출 실행 설정 (webtext.yml 매핑 대상).
 * 기본 출력 디렉터리도 여기 들어간다. 전역 상수로 두지 않고 오케스트레이터 생성 시 전달한다.
 */
public final class ExtractConfig {

    /** 일반 브라우저로 보이는 고정 식별 헤더 */
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 "
                    + "(KHTML, like Gecko) Version/18.0.1 Safari/605.1.15";

    public static final Path DEFAULT_OUTPUT_DIR =
            Path.of(System.getProperty("user.home"), "Documents", "URL Text");

    // ---------- 기본 필드 ----------
    private String userAgent = DEFAULT_USER_AGENT;
    private Duration timeout = Duration.ofSeconds(30);        // 요청(응답 대기) 타임아웃
    private Duration connectTimeout = Duration.ofSeconds(10); // 연결 수립 타임아웃
    private int maxRetries = 3;                                // 연결 실패 재시도 횟수(첫 시도 제외)
    private Duration retryBaseDelay = Duration.ofMillis(500);  // 500 → 1000 → 2000ms
    private Path defaultOutputDir = DEFAULT_OUTPUT_DIR;
    private String inputSuffix = ".txt";

    // ---------- getters ----------
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public Path getDefaultOutputDir() { return defaultOutputDir; }
    public String getInputSuffix() { return inputSuffix; }

    // ---------- fluent setters ----------
    public ExtractConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public ExtractConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ExtractConfig setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }
    public ExtractConfig setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
    public ExtractConfig setRetryBaseDelay(Duration retryBaseDelay) { this.retryBaseDelay = retryBaseDelay; return this; }
    public ExtractConfig setDefaultOutputDir(Path dir) { this.defaultOutputDir = dir; return this; }
    public ExtractConfig setInputSuffix(String inputSuffix) { this.inputSuffix = inputSuffix; return this; }

    public ExtractConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public ExtractConfig setConnectTimeoutMs(long ms) {
        this.connectTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero())
            throw new IllegalArgumentException("connectTimeout must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (retryBaseDelay == null || retryBaseDelay.isNegative())
            throw new IllegalArgumentException("retryBaseDelay must be >= 0");
        Objects.requireNonNull(defaultOutputDir, "defaultOutputDir");
        if (inputSuffix == null || inputSuffix.isBlank())
            throw new IllegalArgumentException("inputSuffix must not be blank");
    }

    public static ExtractConfig defaults() { return new ExtractConfig(); }
}
