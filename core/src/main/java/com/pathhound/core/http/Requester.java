package com.pathhound.core.http;

import com.pathhound.core.api.IHttpTransport;
import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.util.Sleeper;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 전송 + 재시도 묶음. 최종 결과와 재시도 횟수만 돌려준다(중간 실패는 집계하지 않음).
 *
 * <p>설정된 공통 헤더와 쿼리(name=value)는 모든 요청에 붙는다.
 * 응답의 URL 은 쿼리를 붙이기 전 URL 로 되돌려서, 결과/재귀 판정은 경로만 본다.</p>
 */
public final class Requester {

    /** 요청 한 건의 최종 결과 */
    public record Outcome(HttpResponseData data, int retries) {}

    private final IHttpTransport transport;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Map<String, String> headers;
    private final String query;

    public Requester(IHttpTransport transport, RetryPolicy policy, Sleeper sleeper) {
        this(transport, policy, sleeper, Map.of(), List.of());
    }

    public Requester(IHttpTransport transport, RetryPolicy policy, Sleeper sleeper,
                     Map<String, String> headers, List<String> queries) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.headers = Map.copyOf(headers == null ? Map.of() : headers);
        this.query = String.join("&", queries == null ? List.of() : queries);
    }

    public Outcome get(URI url) throws InterruptedException {
        return send(url, "GET", Map.of());
    }

    /** 호출자가 준 헤더가 공통 헤더보다 우선한다. */
    public Outcome send(URI url, String method, Map<String, String> extra) throws InterruptedException {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        if (extra != null) merged.putAll(extra);
        URI target = withQuery(url, query);

        CountingRetryPolicy counting = new CountingRetryPolicy(policy);
        int attempt = 1;
        while (true) {
            HttpResponseData data = transport.send(target, method, merged);
            if (data == null) {
                throw new IllegalStateException("transport returned null for " + target);
            }
            if (!counting.shouldRetry(data.getStatusCode(), attempt)) {
                return new Outcome(target == url ? data : relocate(data, url), counting.getRetryCount());
            }
            Duration delay = counting.nextDelay(attempt);
            sleeper.sleep(delay);
            attempt++;
        }
    }

    static URI withQuery(URI url, String query) {
        if (query == null || query.isEmpty()) return url;
        String s = url.toString();
        int hash = s.indexOf('#');
        String fragment = "";
        if (hash >= 0) {
            fragment = s.substring(hash);
            s = s.substring(0, hash);
        }
        String sep = url.getRawQuery() == null ? "?" : "&";
        return URI.create(s + sep + query + fragment);
    }

    private static HttpResponseData relocate(HttpResponseData d, URI url) {
        return HttpResponseData.builder()
                .url(url)
                .method(d.getMethod())
                .statusCode(d.getStatusCode())
                .headers(d.getHeaders())
                .body(d.getBody())
                .contentType(d.getContentType())
                .responseTimeMs(d.getResponseTimeMs())
                .error(d.getError())
                .errorMessage(d.getErrorMessage())
                .build();
    }
}
