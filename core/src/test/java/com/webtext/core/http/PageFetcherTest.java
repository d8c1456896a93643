package com.webtext.core.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webtext.core.model.ExtractConfig;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.FetchResult;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PageFetcherTest {
    static HttpServer s;
    static ExecutorService pool;
    static int port;
    static final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    static final AtomicInteger targetHits = new AtomicInteger();
    static final AtomicInteger errorHits = new AtomicInteger();

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);

        s.createContext("/ok", ex -> {
            lastUserAgent.set(ex.getRequestHeaders().getFirst("User-Agent"));
            respond(ex, 200, "text/html; charset=utf-8", "<html><body><p>hi</p></body></html>");
        });
        s.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/target");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        s.createContext("/target", ex -> {
            targetHits.incrementAndGet();
            respond(ex, 200, "text/plain", "target");
        });
        s.createContext("/error", ex -> {
            errorHits.incrementAndGet();
            respond(ex, 500, "text/plain", "boom");
        });
        s.createContext("/slow", ex -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "text/plain", "late");
        });

        pool = Executors.newCachedThreadPool();
        s.setExecutor(pool);
        s.start();
        port = s.getAddress().getPort();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
        if (pool != null) pool.shutdownNow();
    }

    private static void respond(HttpExchange ex, int code, String ct, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", ct);
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
    }

    private static URI url(String path) {
        return URI.create("http://127.0.0.1:" + port + path);
    }

    /** 대기하지 않고 요청된 지연만 기록 */
    static final class RecordingSleeper implements com.webtext.core.util.Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    @Test
    void success_returns_body_content_type_and_sends_user_agent() {
        var cfg = ExtractConfig.defaults();
        FetchResult r = new PageFetcher(cfg).fetch(url("/ok"));

        assertTrue(r.isSuccess(), r::toString);
        assertEquals(200, r.getStatusCode());
        assertEquals("text/html; charset=utf-8", r.getContentType());
        assertTrue(new String(r.getBody(), StandardCharsets.UTF_8).contains("<p>hi</p>"));
        assertEquals(ExtractConfig.DEFAULT_USER_AGENT, lastUserAgent.get());
    }

    @Test
    void redirect_is_reported_and_never_followed() {
        int before = targetHits.get();
        FetchResult r = new PageFetcher(ExtractConfig.defaults()).fetch(url("/moved"));

        assertFalse(r.isSuccess());
        assertEquals(FailureKind.REDIRECT, r.getFailure());
        assertEquals(302, r.getStatusCode());
        assertTrue(r.getReason().contains("/target"), r.getReason());
        assertEquals(before, targetHits.get(), "Location must not be fetched");
    }

    @Test
    void server_error_is_a_status_failure_and_is_not_retried() throws Exception {
        int before = errorHits.get();
        var sleeper = new RecordingSleeper();
        var policy = new CountingRetryPolicy(new DefaultRetryPolicy());

        FetchResult r = new PageFetcher(ExtractConfig.defaults()).fetchWithRetry(url("/error"), policy, sleeper);

        assertEquals(FailureKind.HTTP_STATUS, r.getFailure());
        assertEquals(500, r.getStatusCode());
        assertEquals("HTTP 500", r.getReason());
        assertEquals(1, errorHits.get() - before);
        assertEquals(0, policy.getRetryCount());
        assertTrue(sleeper.sleeps.isEmpty());
    }

    @Test
    void refused_connection_is_retried_three_times_with_backoff() throws Exception {
        int closedPort;
        try (ServerSocket ss = new ServerSocket(0)) {
            closedPort = ss.getLocalPort();
        }
        var sleeper = new RecordingSleeper();
        var policy = new CountingRetryPolicy(new DefaultRetryPolicy());

        FetchResult r = new PageFetcher(ExtractConfig.defaults())
                .fetchWithRetry(URI.create("http://127.0.0.1:" + closedPort + "/"), policy, sleeper);

        assertEquals(FailureKind.CONNECT, r.getFailure(), r::toString);
        assertEquals(-1, r.getStatusCode());
        assertEquals(3, policy.getRetryCount());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000), Duration.ofMillis(2000)), sleeper.sleeps);
    }

    @Test
    void slow_response_times_out_without_retry() throws Exception {
        var cfg = ExtractConfig.defaults().setTimeout(Duration.ofMillis(300));
        var sleeper = new RecordingSleeper();
        var policy = new CountingRetryPolicy(DefaultRetryPolicy.from(cfg));

        FetchResult r = new PageFetcher(cfg).fetchWithRetry(url("/slow"), policy, sleeper);

        assertEquals(FailureKind.TIMEOUT, r.getFailure(), r::toString);
        assertEquals(0, policy.getRetryCount());
        assertTrue(sleeper.sleeps.isEmpty());
    }

    @Test
    void sender_hook_exceptions_are_classified() {
        var cfg = ExtractConfig.defaults();
        URI u = URI.create("https://example.invalid/");

        FetchResult io = new PageFetcher(cfg, (PageFetcher.HttpSender) req -> { throw new IOException("reset"); }).fetch(u);
        assertEquals(FailureKind.NETWORK, io.getFailure());
        assertTrue(io.getReason().contains("reset"));

        FetchResult unknown = new PageFetcher(cfg, (PageFetcher.HttpSender) req -> {
            throw new java.net.UnknownHostException("example.invalid");
        }).fetch(u);
        assertEquals(FailureKind.CONNECT, unknown.getFailure());
    }

    @Test
    void interrupted_send_restores_the_flag() {
        var cfg = ExtractConfig.defaults();
        FetchResult r = new PageFetcher(cfg, (PageFetcher.HttpSender) req -> { throw new InterruptedException(); })
                .fetch(URI.create("https://example.com/"));
        try {
            assertEquals(FailureKind.NETWORK, r.getFailure());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
