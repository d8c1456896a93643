package com.webtext.core.http;

import com.webtext.core.model.ExtractConfig;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.FetchResult;

import java.time.Duration;

/**
 * 연결 수립 실패(CONNECT)에서만 재시도. 기본 3회, 500ms → 1000ms → 2000ms.
 * HTTP 상태 코드(4xx/5xx), 리다이렉트, 응답 타임아웃은 재시도하지 않고 그대로 돌려준다.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 500); }

    public DefaultRetryPolicy(int maxRetries, long baseMillis) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseMillis = Math.max(0, baseMillis);
    }

    public static DefaultRetryPolicy from(ExtractConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxRetries(), cfg.getRetryBaseDelay().toMillis());
    }

    @Override public boolean shouldRetry(FetchResult result, int attempt) {
        if (result == null || result.isSuccess()) return false;
        if (attempt > maxRetries) return false;
        return result.getFailure() == FailureKind.CONNECT;
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(Math.max(0, attempt - 1), 20);
        return Duration.ofMillis(baseMillis * (1L << shift));   // 500, 1000, 2000...
    }

    @Override public int maxAttempts() { return maxRetries + 1; }
}
