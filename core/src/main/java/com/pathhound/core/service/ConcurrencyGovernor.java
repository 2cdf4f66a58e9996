package com.pathhound.core.service;

import com.pathhound.core.control.PauseController;
import com.pathhound.core.model.Scan;
import com.pathhound.core.scan.ScanRegistry;
import com.pathhound.core.util.NamedThreadFactory;
import com.pathhound.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 스캔 입장 관리자.
 * 활성(RUNNING+PAUSED) 수가 scanLimit 미만일 때만 QUEUED 스캔을 등록 순으로 실행한다.
 * 실행 중인 스캔이 없고 대기 스캔도 없으면(또는 종료 신호 후 실행 중인 스캔이 모두 끝나면) 반환한다.
 */
final class ConcurrencyGovernor {
    private static final Logger LOG = LoggerFactory.getLogger(ConcurrencyGovernor.class);
    private static final StructuredLog SLOG = StructuredLog.get(ConcurrencyGovernor.class);

    private static final long POLL_MS = 200;

    private final ScanRegistry registry;
    private final int scanLimit;
    private final PauseController pause;
    private final AtomicBoolean shutdown;
    private final Function<Scan, Runnable> executions;

    ConcurrencyGovernor(ScanRegistry registry, int scanLimit, PauseController pause,
                        AtomicBoolean shutdown, Function<Scan, Runnable> executions) {
        this.registry = registry;
        this.scanLimit = scanLimit;
        this.pause = pause;
        this.shutdown = shutdown;
        this.executions = executions;
    }

    void run() throws InterruptedException {
        ExecutorService runners = new ThreadPoolExecutor(0, Integer.MAX_VALUE, 30L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new NamedThreadFactory("scan-runner"));
        AtomicInteger inFlight = new AtomicInteger();
        try {
            while (true) {
                if (!pause.isPaused() && !shutdown.get()) {
                    Optional<Scan> next;
                    while ((next = registry.tryAdmit(scanLimit)).isPresent()) {
                        Scan scan = next.get();
                        inFlight.incrementAndGet();
                        SLOG.forScan(scan.getId()).debug("scan-admitted",
                                "url", scan.getBaseUrl(), "active", registry.activeCount());
                        runners.execute(() -> {
                            try {
                                executions.apply(scan).run();
                            } finally {
                                inFlight.decrementAndGet();
                            }
                        });
                    }
                }
                if (inFlight.get() == 0 && (shutdown.get() || !registry.hasQueued())) break;
                registry.awaitChange(POLL_MS, TimeUnit.MILLISECONDS);
            }
        } finally {
            runners.shutdown();
            if (!runners.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Scan runners did not stop in time; forcing shutdown");
                runners.shutdownNow();
            }
        }
    }
}
