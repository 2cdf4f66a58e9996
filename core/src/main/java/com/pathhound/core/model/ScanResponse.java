package com.pathhound.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 필터 파이프라인에 들어가는 정규화된 응답(불변).
 *
 * <ul>
 *   <li>contentLength = max(Content-Length 헤더, 본문 UTF-8 바이트 수)</li>
 *   <li>lineCount = 줄 수, wordCount = 줄별 공백 토큰 수의 합</li>
 *   <li>headers 는 이름 소문자 + 첫 번째 값만 보관</li>
 *   <li>body 는 분류/링크 추출 동안만 들고 다니며 상태 파일에는 저장하지 않는다</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = ScanResponse.Builder.class)
public final class ScanResponse {
    private final URI url;
    private final String method;
    private final int statusCode;
    private final long contentLength;
    private final long lineCount;
    private final long wordCount;
    private final Map<String, String> headers;
    private final boolean wildcard;
    private final Instant timestamp;
    private final String body;

    private ScanResponse(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.method = (b.method == null ? "GET" : b.method);
        this.statusCode = b.statusCode;
        this.contentLength = Math.max(0, b.contentLength);
        this.lineCount = Math.max(0, b.lineCount);
        this.wordCount = Math.max(0, b.wordCount);
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.wildcard = b.wildcard;
        this.timestamp = b.timestamp;
        this.body = (b.body == null ? "" : b.body);
    }

    /** 전송 결과를 응답 모델로 변환(카운트 계산 포함) */
    public static ScanResponse from(HttpResponseData data) {
        Objects.requireNonNull(data, "data");
        String body = data.getBody();

        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : data.getHeaders().entrySet()) {
            if (e.getKey() == null) continue;
            List<String> vs = e.getValue();
            headers.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), (vs == null || vs.isEmpty()) ? "" : vs.get(0));
        }

        long declared = -1;
        String cl = headers.get("content-length");
        if (cl != null) {
            try { declared = Long.parseLong(cl.trim()); } catch (NumberFormatException ignore) { /* 헤더 무시 */ }
        }
        long actual = body.getBytes(StandardCharsets.UTF_8).length;

        return builder()
                .url(data.getUrl())
                .method(data.getMethod())
                .statusCode(data.getStatusCode())
                .contentLength(Math.max(declared, actual))
                .lineCount(countLines(body))
                .wordCount(countWords(body))
                .headers(headers)
                .timestamp(Instant.now())
                .body(body)
                .build();
    }

    static long countLines(String body) {
        if (body == null || body.isEmpty()) return 0;
        return body.lines().count();
    }

    static long countWords(String body) {
        if (body == null || body.isEmpty()) return 0;
        long n = 0;
        for (String line : body.split("\\R")) {
            String t = line.trim();
            if (!t.isEmpty()) n += t.split("\\s+").length;
        }
        return n;
    }

    public URI getUrl() { return url; }
    public String getMethod() { return method; }
    public int getStatusCode() { return statusCode; }
    public long getContentLength() { return contentLength; }
    public long getLineCount() { return lineCount; }
    public long getWordCount() { return wordCount; }
    public Map<String, String> getHeaders() { return headers; }
    public boolean isWildcard() { return wildcard; }
    public Instant getTimestamp() { return timestamp; }

    @JsonIgnore
    public String getBody() { return body; }

    public String getPath() {
        String p = url.getRawPath();
        return (p == null || p.isEmpty()) ? "/" : p;
    }

    /** 소문자 이름으로 헤더 조회 */
    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * 응답이 속한 디렉터리(마지막 '/' 까지). 디렉터리 자체의 응답(".../dir/")은 부모 디렉터리로 본다.
     * 와일드카드 시그니처의 키.
     */
    @JsonIgnore
    public String getBaseDirectory() {
        return baseDirectoryOf(url);
    }

    public static String baseDirectoryOf(URI u) {
        String s = u.toString();
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);

        int schemeEnd = s.indexOf("://");
        int pathStart = (schemeEnd >= 0) ? s.indexOf('/', schemeEnd + 3) : s.indexOf('/');
        if (pathStart < 0) return s + "/";

        if (s.endsWith("/") && s.length() - 1 > pathStart) {
            s = s.substring(0, s.length() - 1);
        }
        int last = s.lastIndexOf('/');
        return (last < pathStart) ? s.substring(0, pathStart + 1) : s.substring(0, last + 1);
    }

    /**
     * 디렉터리 판정:
     * 3xx 이면 Location 이 "현재 URL + /" 일 때, 2xx/403 이면 경로가 '/' 로 끝날 때.
     */
    @JsonIgnore
    public boolean isDirectory() {
        if (statusCode >= 300 && statusCode < 400) {
            String loc = header("location");
            if (loc == null || loc.isBlank()) return false;
            String withSlash = url.toString() + "/";
            String pathWithSlash = getPath() + "/";
            return loc.equals(withSlash) || loc.equals(pathWithSlash);
        }
        if ((statusCode >= 200 && statusCode < 300) || statusCode == 403) {
            return getPath().endsWith("/");
        }
        return false;
    }

    /** 마지막 경로 세그먼트에 '.' 이 없고 쿼리가 없으면 확장자 없는 리소스로 본다. */
    @JsonIgnore
    public boolean isExtensionless() {
        if (url.getRawQuery() != null) return false;
        String p = getPath();
        if (p.endsWith("/")) return true;
        String last = p.substring(p.lastIndexOf('/') + 1);
        return !last.contains(".");
    }

    /** 와일드카드 표시만 바꾼 복사본 */
    public ScanResponse withWildcard(boolean flag) {
        if (flag == wildcard) return this;
        return toBuilder().wildcard(flag).build();
    }

    public Builder toBuilder() {
        return builder()
                .url(url).method(method).statusCode(statusCode)
                .contentLength(contentLength).lineCount(lineCount).wordCount(wordCount)
                .headers(headers).wildcard(wildcard).timestamp(timestamp).body(body);
    }

    /** 중복 제거 키: METHOD + URL */
    public String key() {
        return method + " " + url;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%3d %6s %9dl %9dw %9dc %s%s",
                statusCode, method, lineCount, wordCount, contentLength, url, wildcard ? " (wildcard)" : "");
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private URI url;
        private String method;
        private int statusCode;
        private long contentLength;
        private long lineCount;
        private long wordCount;
        private Map<String, String> headers;
        private boolean wildcard;
        private Instant timestamp;
        private String body;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder contentLength(long contentLength) { this.contentLength = contentLength; return this; }
        public Builder lineCount(long lineCount) { this.lineCount = lineCount; return this; }
        public Builder wordCount(long wordCount) { this.wordCount = wordCount; return this; }
        public Builder headers(Map<String, String> headers) { this.headers = headers; return this; }
        public Builder wildcard(boolean wildcard) { this.wildcard = wildcard; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        @JsonIgnore
        public Builder body(String body) { this.body = body; return this; }

        public ScanResponse build() {
            return new ScanResponse(this);
        }
    }
}
