package com.webtext.core.http;

import com.webtext.core.api.IPageFetcher;
import com.webtext.core.model.ExtractConfig;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.FetchResult;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Objects;

/** java.net.http 기반 GET. 응답/예외를 FetchResult로 분류한다. */
public class PageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ExtractConfig config;
    private final HttpSender sender;

    public PageFetcher(ExtractConfig config) {
        this(config, HttpClientFactory.create(config));
    }

    public PageFetcher(ExtractConfig config, HttpClient client) {
        this(config, req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray()));
    }

    public PageFetcher(ExtractConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public FetchResult fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpClientFactory.get(url, config);
            HttpResponse<byte[]> resp = sender.send(req);
            return classify(url, resp, elapsedMs(start));
        } catch (HttpConnectTimeoutException e) {
            return FetchResult.failure(url, FailureKind.CONNECT, "connect timed out", elapsedMs(start));
        } catch (HttpTimeoutException e) {
            return FetchResult.failure(url, FailureKind.TIMEOUT, "request timed out", elapsedMs(start));
        } catch (ConnectException | UnknownHostException e) {
            return FetchResult.failure(url, FailureKind.CONNECT, describe(e), elapsedMs(start));
        } catch (IOException e) {
            FailureKind kind = (e.getCause() instanceof UnresolvedAddressException)
                    ? FailureKind.CONNECT : FailureKind.NETWORK;
            return FetchResult.failure(url, kind, describe(e), elapsedMs(start));
        } catch (IllegalArgumentException e) {
            // 지원하지 않는 스킴 등 요청 자체를 만들 수 없는 경우
            return FetchResult.failure(url, FailureKind.NETWORK, describe(e), elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(url, FailureKind.NETWORK, "interrupted", elapsedMs(start));
        }
    }

    private static FetchResult classify(URI url, HttpResponse<byte[]> resp, long elapsedMs) {
        int status = resp.statusCode();
        var headers = resp.headers();
        FetchResult.Builder b = FetchResult.builder()
                .url(url)
                .statusCode(status)
                .headers(headers.map())
                .contentType(headers.firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs);

        if (status >= 200 && status < 300) {
            return b.body(resp.body()).build();
        }
        if (status >= 300 && status < 400) {
            String location = headers.firstValue("Location").orElse("?");
            return b.failure(FailureKind.REDIRECT, "HTTP " + status + " redirect to " + location).build();
        }
        return b.failure(FailureKind.HTTP_STATUS, "HTTP " + status).build();
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        if (msg == null && e.getCause() != null) msg = String.valueOf(e.getCause());
        return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
