package com.pathhound.core.service;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** 전역 실행 시간 제한. 만료되면 콜백을 한 번 호출한다 */
final class TimeLimitWatchdog {
    private final ScheduledExecutorService timer;
    private final Duration limit;
    private final Runnable onExpire;
    private final AtomicBoolean fired = new AtomicBoolean();
    private ScheduledFuture<?> task;

    TimeLimitWatchdog(ScheduledExecutorService timer, Duration limit, Runnable onExpire) {
        this.timer = timer;
        this.limit = limit;
        this.onExpire = onExpire;
    }

    synchronized void start() {
        if (task != null) return;
        task = timer.schedule(() -> {
            if (fired.compareAndSet(false, true)) onExpire.run();
        }, limit.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void cancel() {
        if (task != null) task.cancel(false);
    }

    boolean hasFired() {
        return fired.get();
    }
}
