package com.webtext.core.service;

import com.webtext.core.api.IContentExtractor;
import com.webtext.core.api.IPageFetcher;
import com.webtext.core.extract.ReadabilityExtractor;
import com.webtext.core.http.DefaultRetryPolicy;
import com.webtext.core.model.ExtractedDocument;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.FetchResult;
import com.webtext.core.model.ItemResult;
import com.webtext.core.model.UrlItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PageTextExtractorTest {

    private static final IContentExtractor ECHO = (raw, ct, base) ->
            new ExtractedDocument("Title", new String(raw, StandardCharsets.UTF_8));

    private static FetchResult ok(URI u, String body) {
        return FetchResult.builder().url(u).statusCode(200).contentType("text/html")
                .body(body.getBytes(StandardCharsets.UTF_8)).build();
    }

    private static PageTextExtractor pipeline(IPageFetcher fetcher, IContentExtractor extractor, List<Duration> sleeps) {
        return new PageTextExtractor(fetcher, extractor, DefaultRetryPolicy::new, sleeps::add);
    }

    @Test
    void success_joins_title_and_body_then_sanitizes() {
        IPageFetcher fetcher = u -> ok(u, "<p>Tom &amp; Jerry</p>");

        ItemResult r = pipeline(fetcher, ECHO, new ArrayList<>()).extract(new UrlItem(2, "https://example.com/a"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.index()).isEqualTo(2);
        assertThat(r.text()).isEqualTo("Title\nTom & Jerry");
        assertThat(r.httpStatus()).isEqualTo(200);
        assertThat(r.retries()).isZero();
    }

    @Test
    void connect_failures_are_retried_and_counted_per_item() {
        AtomicInteger calls = new AtomicInteger();
        IPageFetcher flaky = u -> calls.incrementAndGet() < 3
                ? FetchResult.failure(u, FailureKind.CONNECT, "refused", 1)
                : ok(u, "<p>recovered</p>");
        List<Duration> sleeps = new ArrayList<>();
        PageTextExtractor p = pipeline(flaky, ECHO, sleeps);

        ItemResult r = p.extract(new UrlItem(0, "https://example.com/flaky"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.retries()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));

        // 다음 항목은 새 정책으로 시작
        ItemResult next = p.extract(new UrlItem(1, "https://example.com/next"));
        assertThat(next.retries()).isZero();
    }

    @Test
    void failed_fetch_becomes_empty_failure_result() {
        IPageFetcher notFound = u -> FetchResult.builder().url(u).statusCode(404)
                .failure(FailureKind.HTTP_STATUS, "HTTP 404").build();

        ItemResult r = pipeline(notFound, ECHO, new ArrayList<>()).extract(new UrlItem(5, "https://example.com/missing"));

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.failure()).isEqualTo(FailureKind.HTTP_STATUS);
        assertThat(r.reason()).isEqualTo("HTTP 404");
        assertThat(r.httpStatus()).isEqualTo(404);
        assertThat(r.text()).isEmpty();
    }

    @Test
    void extraction_error_is_contained() {
        IContentExtractor broken = (raw, ct, base) -> { throw new IllegalStateException("parser blew up"); };

        ItemResult r = pipeline(u -> ok(u, "<p>x</p>"), broken, new ArrayList<>())
                .extract(new UrlItem(0, "https://example.com/"));

        assertThat(r.failure()).isEqualTo(FailureKind.EXTRACTION);
        assertThat(r.reason()).contains("parser blew up");
        assertThat(r.text()).isEmpty();
    }

    @Test
    void unexpected_fetcher_exception_is_contained() {
        IPageFetcher explodes = u -> { throw new IllegalStateException("boom"); };

        ItemResult r = pipeline(explodes, ECHO, new ArrayList<>()).extract(new UrlItem(0, "https://example.com/"));

        assertThat(r.failure()).isEqualTo(FailureKind.NETWORK);
        assertThat(r.httpStatus()).isEqualTo(-1);
    }

    @Test
    @DisplayName("수만 단계로 중첩된 페이지도 배치를 멈추지 않고 처리한다")
    void deeply_nested_page_is_extracted_without_blowing_the_stack() {
        int depth = 30_000;
        StringBuilder html = new StringBuilder("<html><head><title>Deep</title></head><body>");
        html.append("<span>".repeat(depth));
        html.append("<!-- buried note --><p>Deep paragraph text that is long enough to be scored.</p>");
        html.append("</span>".repeat(depth));
        html.append("</body></html>");
        IPageFetcher fetcher = u -> ok(u, html.toString());

        ItemResult r = pipeline(fetcher, new ReadabilityExtractor(), new ArrayList<>())
                .extract(new UrlItem(0, "https://example.com/deep"));

        assertThat(r.isSuccess()).as("%s", r.reason()).isTrue();
        assertThat(r.text())
                .contains("Deep paragraph text that is long enough to be scored.")
                .doesNotContain("buried note");
    }

    @Test
    void interrupted_backoff_stops_the_item_and_keeps_the_flag() {
        IPageFetcher refused = u -> FetchResult.failure(u, FailureKind.CONNECT, "refused", 1);
        PageTextExtractor p = new PageTextExtractor(refused, ECHO, DefaultRetryPolicy::new,
                d -> { throw new InterruptedException(); });
        try {
            ItemResult r = p.extract(new UrlItem(0, "https://example.com/"));

            assertThat(r.failure()).isEqualTo(FailureKind.NETWORK);
            assertThat(r.reason()).isEqualTo("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
