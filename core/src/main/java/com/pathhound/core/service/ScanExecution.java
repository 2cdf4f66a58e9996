package com.pathhound.core.service;

import com.pathhound.core.filter.FilterDecision;
import com.pathhound.core.http.Requester;
import com.pathhound.core.model.ErrorKind;
import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.model.ScanStatus;
import com.pathhound.core.model.ScanType;
import com.pathhound.core.scan.DirectoryListing;
import com.pathhound.core.util.NamedThreadFactory;
import com.pathhound.core.util.RateLimiter;
import com.pathhound.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스캔 하나의 실행 단위.
 *
 * <p>흐름: (INITIAL이면 robots.txt) → (본문을 못 본 DIRECTORY면 목록 페이지 확인) → 와일드카드 탐지 → 워커 N개가 커서를 나눠 소비.
 * 워커는 매 요청 경계에서 일시정지/취소/스레드 축소를 확인한다.
 * 워드리스트를 끝까지 소비하고 취소되지 않았을 때만 COMPLETE로 전이한다.</p>
 */
final class ScanExecution implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(ScanExecution.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanExecution.class);

    private final Scan scan;
    private final ScanContext ctx;
    private final LinkFollower links;
    private final StructuredLog slog;

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean exhausted = new AtomicBoolean();

    ScanExecution(Scan scan, ScanContext ctx, LinkFollower links) {
        this.scan = scan;
        this.ctx = ctx;
        this.links = links;
        this.slog = SLOG.forScan(scan.getId());
    }

    @Override
    public void run() {
        final String id = scan.getId();
        final RunConfig cfg = ctx.config();
        final RateLimiter limiter = new RateLimiter(scan.getRateLimit());
        final AutoTuner tuner = new AutoTuner(cfg, id, ctx.registry(), limiter);
        final long t0 = System.nanoTime();

        LOG.info("Scan start [{}] {} ({}, depth {}, threads {}, rate {})",
                scan.shortId(), scan.getBaseUrl(), scan.getScanType(), scan.getDepth(),
                scan.getThreadCount(), scan.getRateLimit() == 0 ? "unlimited" : scan.getRateLimit());
        slog.info("scan-start", "url", scan.getBaseUrl(), "type", scan.getScanType(),
                "depth", scan.getDepth(), "threads", scan.getThreadCount(), "rate", scan.getRateLimit());

        try {
            if (scan.getScanType() == ScanType.INITIAL && cfg.isExtractLinks() && !ctx.shouldStop(id)) {
                links.fromRobots(scan, limiter, tuner);
            }
            if (ctx.recursion().needsListingCheck(scan) && !ctx.shouldStop(id)
                    && isDirectoryListing(limiter, tuner)) {
                exhausted.set(true);
                return;
            }
            if (!ctx.shouldStop(id)) {
                ctx.wildcards().detect(scan.getBaseUrl(), limiter);
            }
            if (!ctx.shouldStop(id)) {
                runWorkers(limiter, tuner);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.debug("Scan [{}] interrupted", scan.shortId());
        } catch (RuntimeException e) {
            LOG.error("Scan [{}] failed: {}", scan.shortId(), e.toString(), e);
            slog.error("scan-failed", e, "url", scan.getBaseUrl());
            ctx.registry().cancel(id, "error: " + e.getMessage());
        } finally {
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            boolean cancelled = ctx.registry().isCancelled(id);
            if (exhausted.get() && !cancelled && !ctx.shutdown().get()) {
                ctx.registry().transition(id, ScanStatus.COMPLETE);
                LOG.info("Scan complete [{}] {} in {} ms", scan.shortId(), scan.getBaseUrl(), ms);
            }
            slog.info("scan-done", "url", scan.getBaseUrl(), "ms", ms,
                    "status", ctx.registry().get(id).map(Scan::getStatus).orElse(null));
        }
    }

    /** 목록 페이지면 워드리스트 없이 끝낸다. 링크 추출이 켜져 있으면 목록의 링크는 따라간다. */
    private boolean isDirectoryListing(RateLimiter limiter, AutoTuner tuner) throws InterruptedException {
        limiter.acquire();
        Requester.Outcome out = ctx.requester().get(URI.create(scan.getBaseUrl()));
        ctx.stats().addAttempts(1L + out.retries());
        ctx.stats().addRetries(out.retries());
        tuner.record(AutoTuner.Outcome.of(out.data()));
        if (out.data().isError()) {
            ctx.stats().addError(out.data().getError());
            return false;
        }
        ScanResponse response = ScanResponse.from(out.data());
        if (!DirectoryListing.isListing(response)) return false;

        LOG.info("Directory listing at {}, wordlist skipped", scan.getBaseUrl());
        slog.info("dir-listing", "url", scan.getBaseUrl());
        if (ctx.config().isExtractLinks()) {
            links.fromResponse(scan, response, limiter, tuner);
        }
        return true;
    }

    private void runWorkers(RateLimiter limiter, AutoTuner tuner) throws InterruptedException {
        final int n = Math.max(1, scan.getThreadCount());
        final RequestCursor cursor = new RequestCursor(
                scan.getBaseUrl(), ctx.wordlist(), ctx.config().isAddSlash(), ctx.config().getExtensions());

        ExecutorService pool = new ThreadPoolExecutor(n, n, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory("scan-" + scan.shortId() + "-w"));
        List<Future<?>> futures = new ArrayList<>(n);
        try {
            for (int i = 0; i < n; i++) {
                final int index = i;
                futures.add(pool.submit(() -> {
                    work(index, cursor, limiter, tuner);
                    return null;
                }));
            }
            pool.shutdown();
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException ee) {
                    Throwable cause = ee.getCause();
                    if (cause instanceof RuntimeException re) throw re;
                    if (cause instanceof Error err) throw err;
                    // InterruptedException 으로 끝난 워커: 전체 중단 신호
                    throw new InterruptedException("worker interrupted");
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    /** 워커 루프. index ≥ 현재 허용 스레드 수가 되면 스스로 은퇴한다 */
    private void work(int index, RequestCursor cursor, RateLimiter limiter, AutoTuner tuner)
            throws InterruptedException {
        final String id = scan.getId();
        while (true) {
            ctx.pause().awaitIfPaused();
            if (ctx.shouldStop(id)) return;
            if (index >= ctx.registry().currentThreads(id)) {
                LOG.debug("Worker {} of [{}] retired after tuning", index, scan.shortId());
                return;
            }

            URI url = cursor.next();
            if (url == null) {
                exhausted.set(true);
                return;
            }
            if (ctx.exclusion().isExcluded(url)) continue;

            limiter.acquire();
            if (ctx.shouldStop(id)) return;

            int current = inFlight.incrementAndGet();
            ctx.stats().observeConcurrency(current);
            long start = System.nanoTime();
            Requester.Outcome out;
            try {
                out = ctx.requester().get(url);
            } finally {
                inFlight.decrementAndGet();
                ctx.stats().addWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }
            ctx.stats().addAttempts(1L + out.retries());
            ctx.stats().addRetries(out.retries());

            HttpResponseData data = out.data();
            tuner.record(AutoTuner.Outcome.of(data));
            if (data.isError()) {
                ctx.stats().addError(data.getError());
                if (data.getError() == ErrorKind.RESOURCE_EXHAUSTED) {
                    LOG.warn("Resource exhausted on {}: {}", url, data.getErrorMessage());
                } else {
                    LOG.debug("Request failed {} ({}): {}", url, data.getError(), data.getErrorMessage());
                }
                continue;
            }
            handle(ScanResponse.from(data), limiter, tuner);
        }
    }

    private void handle(ScanResponse response, RateLimiter limiter, AutoTuner tuner)
            throws InterruptedException {
        FilterDecision d = ctx.pipeline().classify(response, ctx.filters().snapshot());
        if (!d.accepted()) {
            ctx.stats().addDropped(d.droppedBy());
            return;
        }
        ctx.report(d.response());

        // 취소 이후 도착한 응답으로는 재귀/추출하지 않음
        if (ctx.shouldStop(scan.getId())) return;
        if (d.recurse()) {
            ctx.recursion().consider(scan, d.response());
        }
        if (ctx.config().isExtractLinks()) {
            links.fromResponse(scan, d.response(), limiter, tuner);
        }
    }
}
