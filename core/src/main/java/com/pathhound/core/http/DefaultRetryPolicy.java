package com.pathhound.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 전송 오류(status -1)에서만 재시도. HTTP 상태 코드(429/5xx 포함)는 그대로 결과로 취급한다.
 * 기본 2회 시도, 250ms → 500ms ... (±10% Jitter)
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(2, 250); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return statusCode < 0;
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(10, attempt - 1);
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
