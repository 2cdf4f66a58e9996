package com.pathhound.core.http;

import com.pathhound.core.api.IHttpTransport;
import com.pathhound.core.model.ErrorKind;
import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.RunConfig;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** java.net.http.HttpClient 기반 전송 구현: 예외는 ErrorKind 로 매핑해 status -1 로 반환 */
public class JdkHttpTransport implements IHttpTransport {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final Duration timeout;
    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public JdkHttpTransport(RunConfig config) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public JdkHttpTransport(RunConfig config, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public HttpResponseData send(URI url, String method, Map<String, String> headers) {
        Objects.requireNonNull(url, "url");
        final String m = (method == null ? "GET" : method);
        long start = System.nanoTime();
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .method(m, HttpRequest.BodyPublishers.noBody())
                    .header("User-Agent", userAgent);
            if (headers != null) headers.forEach(rb::setHeader);
            HttpRequest req = rb.build();

            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            HttpHeaders hh = resp.headers();
            Map<String, List<String>> hmap = hh.map();
            String contentType = hh.firstValue("Content-Type").orElse(null);

            return HttpResponseData.builder()
                    .url(url)
                    .method(m)
                    .statusCode(resp.statusCode())
                    .headers(hmap)
                    .body(resp.body() == null ? "" : resp.body())
                    .contentType(contentType)
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return HttpResponseData.failure(url, m, ErrorKind.OTHER, "interrupted", elapsedMs);
        } catch (Exception e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return HttpResponseData.failure(url, m, classify(e), String.valueOf(e.getMessage()), elapsedMs);
        }
    }

    /** 예외 → 오류 분류 (원인 체인까지 확인) */
    static ErrorKind classify(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && msg.contains("Too many open files")) return ErrorKind.RESOURCE_EXHAUSTED;
            if (t instanceof HttpConnectTimeoutException) return ErrorKind.TIMEOUT;
            if (t instanceof HttpTimeoutException) return ErrorKind.TIMEOUT;
            if (t instanceof ConnectException || t instanceof UnresolvedAddressException) return ErrorKind.CONNECTION;
        }
        if (e instanceof IOException) return ErrorKind.CONNECTION;
        return ErrorKind.OTHER;
    }
}
