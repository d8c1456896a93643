package com.webtext.core.http;

import com.webtext.core.model.ExtractConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * 배치 1회 동안 재사용할 HttpClient와 요청 템플릿.
 * 리다이렉트는 절대 따라가지 않는다(요청한 URL 그대로의 결과만 남긴다).
 */
public final class HttpClientFactory {
    private HttpClientFactory() {}

    public static HttpClient create(ExtractConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(cfg.getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /** 고정 User-Agent + 요청 타임아웃을 붙인 GET. http/https 공통. */
    public static HttpRequest get(URI url, ExtractConfig cfg) {
        return HttpRequest.newBuilder(url)
                .timeout(cfg.getTimeout())
                .header("User-Agent", cfg.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .GET()
                .build();
    }
}
