package com.webtext.core.api;

import com.webtext.core.http.RetryPolicy;
import com.webtext.core.model.FetchResult;
import com.webtext.core.util.Sleeper;

import java.net.URI;

/** 페이지 1건 GET 계약. 실패도 FetchResult로 돌려주고 예외를 던지지 않는다. */
public interface IPageFetcher {

    FetchResult fetch(URI url);

    /** 정책이 허락하는 동안 재시도. 대기 중 인터럽트되면 InterruptedException. */
    default FetchResult fetchWithRetry(URI url, RetryPolicy policy, Sleeper sleeper) throws InterruptedException {
        int attempt = 1;
        while (true) {
            FetchResult result = fetch(url);
            if (attempt >= policy.maxAttempts() || !policy.shouldRetry(result, attempt)) {
                return result;
            }
            sleeper.sleep(policy.nextDelay(attempt));
            attempt++;
        }
    }
}
