package com.pathhound.core.service;

import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanStatus;
import com.pathhound.core.model.ScanType;
import com.pathhound.core.scan.ScanRegistry;
import com.pathhound.core.util.RateLimiter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AutoTunerTest {

    private static RunConfig.Builder cfg() {
        return RunConfig.builder().threads(8).rateLimit(100).policyWindow(10);
    }

    private static ScanRegistry registry(RunConfig c) {
        return new ScanRegistry(c.getMaxDepth(), c.getThreads(), c.getRateLimit());
    }

    @Test
    void no_action_until_window_is_full() {
        RunConfig c = cfg().autoTune(true).build();
        ScanRegistry reg = registry(c);
        String id = reg.register("http://t/", ScanType.INITIAL, null, 0);
        AutoTuner t = new AutoTuner(c, id, reg, new RateLimiter(100));

        for (int i = 0; i < 9; i++) {
            assertThat(t.record(AutoTuner.Outcome.ERROR)).isEqualTo(AutoTuner.Action.NONE);
        }
        assertThat(t.record(AutoTuner.Outcome.ERROR)).isEqualTo(AutoTuner.Action.TUNED);
        assertThat(reg.currentThreads(id)).isEqualTo(4);
    }

    @Test
    void tune_halves_threads_and_rate_and_never_goes_below_one() {
        RunConfig c = cfg().autoTune(true).build();
        ScanRegistry reg = registry(c);
        String id = reg.register("http://t/", ScanType.INITIAL, null, 0);
        RateLimiter limiter = new RateLimiter(100);
        AutoTuner t = new AutoTuner(c, id, reg, limiter);

        for (int round = 0; round < 10; round++) {
            for (int i = 0; i < 10; i++) t.record(AutoTuner.Outcome.RATE_LIMITED);
        }
        Scan s = reg.get(id).orElseThrow();
        assertThat(s.getThreadCount()).isEqualTo(1);
        assertThat(s.getRateLimit()).isEqualTo(1);
        assertThat(limiter.getRate()).isEqualTo(1);
        assertThat(s.getStatus()).isEqualTo(ScanStatus.QUEUED); // auto-bail 꺼짐
    }

    @Test
    void healthy_window_changes_nothing() {
        RunConfig c = cfg().autoTune(true).autoBail(true).build();
        ScanRegistry reg = registry(c);
        String id = reg.register("http://t/", ScanType.INITIAL, null, 0);
        AutoTuner t = new AutoTuner(c, id, reg, new RateLimiter(100));

        for (int i = 0; i < 100; i++) {
            AutoTuner.Outcome o = (i % 10 == 0) ? AutoTuner.Outcome.ERROR : AutoTuner.Outcome.OK; // 10%
            assertThat(t.record(o)).isEqualTo(AutoTuner.Action.NONE);
        }
        assertThat(reg.currentThreads(id)).isEqualTo(8);
    }

    @Test
    void bail_cancels_scan_when_tuning_is_disabled() {
        RunConfig c = cfg().autoBail(true).build();
        ScanRegistry reg = registry(c);
        String id = reg.register("http://t/", ScanType.INITIAL, null, 0);
        reg.tryAdmit(0);
        AutoTuner t = new AutoTuner(c, id, reg, new RateLimiter(100));

        AutoTuner.Action last = AutoTuner.Action.NONE;
        for (int i = 0; i < 10; i++) last = t.record(AutoTuner.Outcome.FORBIDDEN);

        assertThat(last).isEqualTo(AutoTuner.Action.BAILED);
        Scan s = reg.get(id).orElseThrow();
        assertThat(s.getStatus()).isEqualTo(ScanStatus.CANCELLED);
        assertThat(s.getCancelReason()).startsWith("auto-bail").contains("403 10/10");
        // 한 번 중단되면 더 평가하지 않음
        assertThat(t.record(AutoTuner.Outcome.FORBIDDEN)).isEqualTo(AutoTuner.Action.NONE);
    }

    @Test
    void unlimited_rate_is_tuned_from_observed_throughput() {
        RunConfig c = RunConfig.builder().threads(2).rateLimit(0).policyWindow(5).autoTune(true).build();
        ScanRegistry reg = registry(c);
        String id = reg.register("http://t/", ScanType.INITIAL, null, 0);
        RateLimiter limiter = new RateLimiter(0);
        AutoTuner t = new AutoTuner(c, id, reg, limiter);

        for (int i = 0; i < 5; i++) t.record(AutoTuner.Outcome.ERROR);

        assertThat(limiter.isUnlimited()).isFalse();
        assertThat(limiter.getRate()).isPositive();
        assertThat(reg.currentThreads(id)).isEqualTo(1);
    }
}
