package com.pathhound.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 전송 계층 결과(본문은 텍스트 기준).
 * 네트워크 오류 시 statusCode=-1, error/errorMessage 가 채워진다(예외는 던지지 않음).
 */
public final class HttpResponseData {
    private final URI url;
    private final String method;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final ErrorKind error;
    private final String errorMessage;

    private HttpResponseData(Builder b) {
        this.url = b.url;
        this.method = (b.method == null ? "GET" : b.method);
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
        this.errorMessage = b.errorMessage;
    }

    public URI getUrl() { return url; }
    public String getMethod() { return method; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public ErrorKind getError() { return error; }
    public String getErrorMessage() { return errorMessage; }

    public boolean isError() { return error != null || statusCode < 0; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null || headers == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 오류 응답 단축 생성 */
    public static HttpResponseData failure(URI url, String method, ErrorKind kind, String message, long elapsedMs) {
        return builder()
                .url(url)
                .method(method)
                .statusCode(-1)
                .error(kind == null ? ErrorKind.OTHER : kind)
                .errorMessage(message)
                .responseTimeMs(elapsedMs)
                .build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private String method;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private ErrorKind error;
        private String errorMessage;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder error(ErrorKind error) { this.error = error; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(url, "url");
            return new HttpResponseData(this);
        }
    }
}
