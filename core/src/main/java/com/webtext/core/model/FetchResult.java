package com.webtext.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 한 번의 GET 결과. 성공(2xx)이면 본문 바이트, 실패면 {@link FailureKind} + 사유를 담는다.
 * 연결 자체가 실패하면 statusCode는 -1.
 */
public final class FetchResult {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String contentType;
    private final long responseTimeMs;
    private final FailureKind failure;   // null이면 성공
    private final String reason;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.failure = b.failure;
        this.reason = b.reason;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public byte[] getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public FailureKind getFailure() { return failure; }
    public String getReason() { return reason; }

    public boolean isSuccess() { return failure == null; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "FetchResult{" + url + " -> " + statusCode + ", " + body.length + " bytes}"
                : "FetchResult{" + url + " -> " + failure + ": " + reason + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    /** 연결/IO 단계 실패용 단축 팩토리 */
    public static FetchResult failure(URI url, FailureKind kind, String reason, long elapsedMs) {
        return builder().url(url).statusCode(-1).failure(kind, reason).responseTimeMs(elapsedMs).build();
    }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private String contentType;
        private long responseTimeMs;
        private FailureKind failure;
        private String reason;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder failure(FailureKind kind, String reason) { this.failure = kind; this.reason = reason; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
