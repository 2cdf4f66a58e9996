package com.pathhound.core.filter;

import com.pathhound.core.http.Requester;
import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.util.RateLimiter;
import com.pathhound.core.util.StructuredLog;
import com.pathhound.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 디렉터리 와일드카드(soft-404) 탐지.
 *
 * <p>존재할 리 없는 경로 두 개(32자 / 96자 토큰)를 요청해 서명을 만든다.
 * 첫 프로브가 상태 코드 단계에서 걸러지면 와일드카드가 아니다.</p>
 */
public final class WildcardDetector {
    private static final Logger LOG = LoggerFactory.getLogger(WildcardDetector.class);
    private static final StructuredLog SLOG = StructuredLog.get(WildcardDetector.class);

    private final Requester requester;
    private final FilterSet filters;
    private final double tolerance;
    private final Supplier<String> tokens;

    public WildcardDetector(Requester requester, FilterSet filters, double tolerance) {
        this(requester, filters, tolerance, () -> UUID.randomUUID().toString().replace("-", ""));
    }

    /** 토큰 공급자 주입(테스트용). 토큰은 32자 이상을 가정한다. */
    public WildcardDetector(Requester requester, FilterSet filters, double tolerance, Supplier<String> tokens) {
        this.requester = Objects.requireNonNull(requester, "requester");
        this.filters = Objects.requireNonNull(filters, "filters");
        this.tolerance = tolerance;
        this.tokens = Objects.requireNonNull(tokens, "tokens");
    }

    /**
     * 베이스 디렉터리를 프로브하고 서명이 나오면 FilterSet 에 설치한다.
     * 프로브 실패는 로그만 남기고 해당 디렉터리는 필터 없이 진행한다.
     */
    public Optional<WildcardSignature> detect(String baseDirectory, RateLimiter limiter) throws InterruptedException {
        Optional<WildcardSignature> existing = filters.wildcardFor(baseDirectory);
        if (existing.isPresent()) return existing;

        String shortToken = tokens.get();
        String longToken = shortToken + tokens.get() + tokens.get();

        Optional<URI> u1 = UrlUtils.join(baseDirectory, shortToken);
        Optional<URI> u2 = UrlUtils.join(baseDirectory, longToken);
        if (u1.isEmpty() || u2.isEmpty()) return Optional.empty();

        if (limiter != null) limiter.acquire();
        HttpResponseData p1 = requester.get(u1.get()).data();
        if (p1.isError()) {
            LOG.warn("Wildcard check failed for {} ({}), continuing unfiltered", baseDirectory, p1.getError());
            return Optional.empty();
        }
        if (!filters.passesStatus(p1.getStatusCode())) {
            LOG.debug("No wildcard under {} (check status {})", baseDirectory, p1.getStatusCode());
            return Optional.empty();
        }
        ScanResponse r1 = ScanResponse.from(p1);

        if (limiter != null) limiter.acquire();
        HttpResponseData p2 = requester.get(u2.get()).data();

        WildcardSignature sig;
        if (p2.isError() || p2.getStatusCode() != p1.getStatusCode()) {
            sig = WildcardSignature.fixed(r1.getStatusCode(), r1.getContentLength());
        } else {
            ScanResponse r2 = ScanResponse.from(p2);
            long len1 = r1.getContentLength();
            long len2 = r2.getContentLength();
            long pathDelta = r2.getPath().length() - r1.getPath().length();
            if (len1 == len2) {
                sig = WildcardSignature.fixed(r1.getStatusCode(), len1);
            } else if (len2 - len1 == pathDelta) {
                sig = WildcardSignature.reflected(r1.getStatusCode(), len1 - r1.getPath().length());
            } else {
                sig = WildcardSignature.banded(r1.getStatusCode(), len1, len2, tolerance);
            }
        }

        if (filters.addWildcard(baseDirectory, sig)) {
            LOG.info("Wildcard detected under {} -> {} status={} length={}",
                    baseDirectory, sig.kind(), sig.status(), sig.length());
            SLOG.info("wildcard-detected",
                    "dir", baseDirectory,
                    "kind", sig.kind().name(),
                    "status", sig.status(),
                    "length", sig.length(),
                    "min", sig.min(),
                    "max", sig.max());
            return Optional.of(sig);
        }
        return filters.wildcardFor(baseDirectory);
    }
}
