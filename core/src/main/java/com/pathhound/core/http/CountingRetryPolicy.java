package com.pathhound.core.http;

import java.time.Duration;
import java.util.Objects;

/** RetryPolicy를 감싸 재시도 횟수를 집계하는 얇은 데코레이터. 요청 한 건마다 새로 만든다. */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private int retries = 0;

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(int statusCode, int attempt) {
        boolean ok = delegate.shouldRetry(statusCode, attempt);
        if (ok) retries++;
        return ok;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public int getRetryCount() {
        return retries;
    }
}
