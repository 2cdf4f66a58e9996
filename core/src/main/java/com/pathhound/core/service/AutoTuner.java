package com.pathhound.core.service;

import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.scan.ScanRegistry;
import com.pathhound.core.util.RateLimiter;
import com.pathhound.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;

/**
 * 스캔 단위 자동 감속(auto-tune) / 자동 중단(auto-bail).
 *
 * <p>최근 N개 요청 결과를 링 버퍼로 유지하고, 버퍼가 가득 찰 때마다 평가한다.
 * 감속은 스레드 수를 절반(최소 1)으로, 레이트를 절반(최소 1)으로 줄이고 창을 비운다.
 * 한 실행 안에서 다시 올리지 않는다.</p>
 */
final class AutoTuner {
    private static final Logger LOG = LoggerFactory.getLogger(AutoTuner.class);
    private static final StructuredLog SLOG = StructuredLog.get(AutoTuner.class);

    /** 403 비율이 이 이상이면 정책 발동 */
    static final double FORBIDDEN_RATIO = 0.90;
    /** 429 비율이 이 이상이면 정책 발동 */
    static final double RATE_LIMITED_RATIO = 0.30;

    enum Outcome {
        OK, ERROR, FORBIDDEN, RATE_LIMITED;

        static Outcome of(HttpResponseData d) {
            if (d.isError()) return ERROR;
            if (d.getStatusCode() == 403) return FORBIDDEN;
            if (d.getStatusCode() == 429) return RATE_LIMITED;
            return OK;
        }
    }

    enum Action { NONE, TUNED, BAILED }

    private final String scanId;
    private final ScanRegistry registry;
    private final RateLimiter limiter;
    private final boolean autoTune;
    private final boolean autoBail;
    private final double tuneRatio;
    private final double bailRatio;

    private final Outcome[] ring;
    private final int[] counts = new int[Outcome.values().length];
    private int size;
    private int head;

    private final long startNs = System.nanoTime();
    private long requests;
    private boolean bailed;

    AutoTuner(RunConfig cfg, String scanId, ScanRegistry registry, RateLimiter limiter) {
        this.scanId = scanId;
        this.registry = registry;
        this.limiter = limiter;
        this.autoTune = cfg.isAutoTune();
        this.autoBail = cfg.isAutoBail();
        this.tuneRatio = cfg.getTuneErrorRatio();
        this.bailRatio = cfg.getBailErrorRatio();
        this.ring = new Outcome[cfg.getPolicyWindow()];
    }

    boolean isEnabled() {
        return autoTune || autoBail;
    }

    synchronized Action record(Outcome o) {
        requests++;
        if (!isEnabled() || bailed) return Action.NONE;

        if (size == ring.length) {
            counts[ring[head].ordinal()]--;
        } else {
            size++;
        }
        ring[head] = o;
        counts[o.ordinal()]++;
        head = (head + 1) % ring.length;

        if (size < ring.length) return Action.NONE;
        return evaluate();
    }

    private Action evaluate() {
        double errors = ratio(Outcome.ERROR);
        double forbidden = ratio(Outcome.FORBIDDEN);
        double limited = ratio(Outcome.RATE_LIMITED);
        int threads = registry.currentThreads(scanId);

        boolean tuningExhausted = !autoTune || threads <= 1;
        boolean bailTrigger = errors >= bailRatio || forbidden >= FORBIDDEN_RATIO || limited >= RATE_LIMITED_RATIO;
        if (autoBail && tuningExhausted && bailTrigger) {
            bailed = true;
            String reason = String.format(Locale.ROOT,
                    "auto-bail: errors %d/%d, 403 %d/%d, 429 %d/%d",
                    counts[Outcome.ERROR.ordinal()], size,
                    counts[Outcome.FORBIDDEN.ordinal()], size,
                    counts[Outcome.RATE_LIMITED.ordinal()], size);
            if (registry.cancel(scanId, reason)) {
                LOG.warn("Scan {} cancelled: {}", shortId(), reason);
                SLOG.forScan(scanId).warn("auto-bail",
                        "errors", counts[Outcome.ERROR.ordinal()],
                        "forbidden", counts[Outcome.FORBIDDEN.ordinal()],
                        "rateLimited", counts[Outcome.RATE_LIMITED.ordinal()],
                        "window", size,
                        "requests", requests);
            }
            return Action.BAILED;
        }

        boolean tuneTrigger = errors >= tuneRatio || forbidden >= FORBIDDEN_RATIO || limited >= RATE_LIMITED_RATIO;
        if (autoTune && tuneTrigger) {
            int rate = limiter.getRate();
            if (threads <= 1 && rate == 1) {
                resetWindow();
                return Action.NONE;
            }
            int newThreads = Math.max(1, threads / 2);
            int newRate = (rate == 0) ? Math.max(1, (int) (observedRps() / 2)) : Math.max(1, rate / 2);
            registry.updateTuning(scanId, newThreads, newRate);
            limiter.setRate(newRate);
            LOG.info("Scan {} slowed down: threads {} -> {}, rate {} -> {}/s (errors {}%, 403 {}%, 429 {}%)",
                    shortId(), threads, newThreads, rate == 0 ? "unlimited" : rate, newRate,
                    pct(errors), pct(forbidden), pct(limited));
            SLOG.forScan(scanId).info("auto-tune",
                    "threadsFrom", threads, "threadsTo", newThreads,
                    "rateFrom", rate, "rateTo", newRate,
                    "errorRatio", errors, "forbiddenRatio", forbidden, "rateLimitedRatio", limited);
            resetWindow();
            return Action.TUNED;
        }
        return Action.NONE;
    }

    private double ratio(Outcome o) {
        return size == 0 ? 0.0 : counts[o.ordinal()] / (double) size;
    }

    private void resetWindow() {
        size = 0;
        head = 0;
        Arrays.fill(counts, 0);
        Arrays.fill(ring, null);
    }

    private double observedRps() {
        double sec = (System.nanoTime() - startNs) / 1_000_000_000.0;
        return sec <= 0 ? requests : requests / sec;
    }

    private static long pct(double r) {
        return Math.round(r * 100);
    }

    private String shortId() {
        return scanId.length() > 8 ? scanId.substring(0, 8) : scanId;
    }
}
