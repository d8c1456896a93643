package com.webtext.core.service;

import com.webtext.core.api.IContentExtractor;
import com.webtext.core.api.IPageFetcher;
import com.webtext.core.extract.TextSanitizer;
import com.webtext.core.http.CountingRetryPolicy;
import com.webtext.core.http.RetryPolicy;
import com.webtext.core.model.ExtractedDocument;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.FetchResult;
import com.webtext.core.model.ItemResult;
import com.webtext.core.model.UrlItem;
import com.webtext.core.util.Sleeper;
import com.webtext.core.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * URL 1건: fetch(리다이렉트 미추적, 연결 실패만 재시도) → 리더빌리티 추출 → 태그/엔티티 정리.
 * 이 경계 밖으로는 예외를 내보내지 않는다. 모든 실패는 빈 텍스트의 ItemResult로 바뀐다.
 */
public final class PageTextExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(PageTextExtractor.class);

    private final IPageFetcher fetcher;
    private final IContentExtractor extractor;
    private final Supplier<RetryPolicy> retryPolicy;
    private final Sleeper sleeper;

    public PageTextExtractor(IPageFetcher fetcher, IContentExtractor extractor,
                             Supplier<RetryPolicy> retryPolicy, Sleeper sleeper) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public ItemResult extract(UrlItem item) {
        final int index = item.index();
        final String url = item.raw();

        URI uri = UrlValidator.toUri(url);
        if (uri == null) {
            LOG.warn("Invalid URL {}", url);
            return ItemResult.failure(index, url, FailureKind.NETWORK, "not a parseable URL", -1, 0);
        }

        CountingRetryPolicy counting = new CountingRetryPolicy(retryPolicy.get());
        FetchResult fetched;
        try {
            fetched = fetcher.fetchWithRetry(uri, counting, sleeper);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Request failed for {}: interrupted during retry backoff", url);
            return ItemResult.failure(index, url, FailureKind.NETWORK, "interrupted", -1, counting.getRetryCount());
        } catch (RuntimeException e) {
            LOG.warn("Request failed for {}: {}", url, e.toString());
            return ItemResult.failure(index, url, FailureKind.NETWORK, e.toString(), -1, counting.getRetryCount());
        }

        int retries = counting.getRetryCount();
        if (retries > 0) {
            LOG.debug("{} retried {} time(s), waited {} ms", url, retries, counting.getTotalBackoff().toMillis());
        }
        if (!fetched.isSuccess()) {
            LOG.warn("Request failed for {}: {} ({})", url, fetched.getReason(), fetched.getFailure());
            return ItemResult.failure(index, url, fetched.getFailure(), fetched.getReason(),
                    fetched.getStatusCode(), retries);
        }

        try {
            ExtractedDocument doc = extractor.extract(fetched.getBody(), fetched.getContentType(), url);
            String text = TextSanitizer.clean(doc.joined());
            LOG.debug("Extracted {} chars from {} (title={})", text.length(), url, doc.title());
            return ItemResult.success(index, url, text, fetched.getStatusCode(), retries);
        } catch (RuntimeException e) {
            LOG.warn("Failed to extract text for {}: {}", url, e.toString());
            return ItemResult.failure(index, url, FailureKind.EXTRACTION, e.toString(),
                    fetched.getStatusCode(), retries);
        }
    }
}
