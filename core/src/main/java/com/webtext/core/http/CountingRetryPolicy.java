package com.webtext.core.http;

import com.webtext.core.model.FetchResult;

import java.time.Duration;
import java.util.Objects;

/**
 * 항목 하나에 대해 실제 허용된 재시도 횟수와 누적 대기 시간을 집계한다.
 * 상태를 가지므로 항목마다 새로 감싼다.
 */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private int retries;
    private Duration backoff = Duration.ZERO;

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(FetchResult result, int attempt) {
        if (!delegate.shouldRetry(result, attempt)) return false;
        retries++;
        return true;
    }

    @Override
    public Duration nextDelay(int attempt) {
        Duration d = delegate.nextDelay(attempt);
        backoff = backoff.plus(d);
        return d;
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public int getRetryCount() {
        return retries;
    }

    /** nextDelay로 내준 대기 시간의 합 */
    public Duration getTotalBackoff() {
        return backoff;
    }
}
