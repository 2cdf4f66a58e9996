package com.pathhound.core.api;

import com.pathhound.core.model.HttpResponseData;

import java.net.URI;
import java.util.Map;

/**
 * HTTP 전송 계층 시임. 구현은 스레드 세이프해야 하며,
 * 네트워크 오류는 예외 대신 statusCode=-1 + ErrorKind 로 돌려준다.
 */
@FunctionalInterface
public interface IHttpTransport {
    HttpResponseData send(URI url, String method, Map<String, String> headers);

    default HttpResponseData get(URI url) {
        return send(url, "GET", Map.of());
    }
}
