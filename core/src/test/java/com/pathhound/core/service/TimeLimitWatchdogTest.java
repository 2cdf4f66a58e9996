package com.pathhound.core.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TimeLimitWatchdogTest {

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    @DisplayName("만료되면 콜백이 한 번 호출된다")
    void fires_once() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        TimeLimitWatchdog w = new TimeLimitWatchdog(timer, Duration.ofMillis(20), () -> {
            calls.incrementAndGet();
            latch.countDown();
        });
        w.start();
        w.start(); // 두 번째 start 는 무시

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(w.hasFired());
        Thread.sleep(50);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("cancel 후에는 콜백이 호출되지 않는다")
    void cancel_before_expiry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TimeLimitWatchdog w = new TimeLimitWatchdog(timer, Duration.ofSeconds(5), calls::incrementAndGet);
        w.start();
        w.cancel();

        Thread.sleep(50);
        assertFalse(w.hasFired());
        assertEquals(0, calls.get());
    }
}
