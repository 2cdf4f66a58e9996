package com.pathhound.core.model;

import com.pathhound.core.filter.FilterRule;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScanStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);        // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);        // 재시도 횟수 총합
    private final AtomicLong sumWallMsAcrossCalls = new AtomicLong(0); // 요청별 벽시계 합
    private final AtomicLong attemptsAcrossCalls  = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);
    private final Map<ErrorKind, AtomicLong> errorsByKind = new EnumMap<>(ErrorKind.class);
    private final Map<FilterRule.Kind, AtomicLong> droppedByRule = new EnumMap<>(FilterRule.Kind.class);

    public ScanStats() {
        for (ErrorKind k : ErrorKind.values()) errorsByKind.put(k, new AtomicLong(0));
        for (FilterRule.Kind k : FilterRule.Kind.values()) droppedByRule.put(k, new AtomicLong(0));
    }

    /** attempts = (1 + retries) for a request */
    public void addAttempts(long attempts) {
        attemptsAcrossCalls.addAndGet(attempts);
        requestsTotal.addAndGet(attempts);
    }
    public void addRetries(long retries) {
        retriesTotal.addAndGet(retries);
    }
    public void addWallTimeMs(long wallMs) {
        sumWallMsAcrossCalls.addAndGet(wallMs);
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public void addError(ErrorKind kind) {
        errors.incrementAndGet();
        errorsByKind.get(kind == null ? ErrorKind.OTHER : kind).incrementAndGet();
    }
    public void addAccepted() {
        accepted.incrementAndGet();
    }
    public void addDropped(FilterRule.Kind kind) {
        if (kind != null) droppedByRule.get(kind).incrementAndGet();
    }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long ret = retriesTotal.get();
        long sumWall = sumWallMsAcrossCalls.get();
        long attempts = Math.max(1, attemptsAcrossCalls.get());
        long avgLatencyMs = sumWall / attempts;
        int maxCC = maxObservedConcurrency.get();
        long dropped = 0;
        for (AtomicLong v : droppedByRule.values()) dropped += v.get();
        return new Snapshot(req, ret, maxCC, avgLatencyMs,
                accepted.get(), dropped, errors.get(),
                errorsByKind.get(ErrorKind.TIMEOUT).get(),
                errorsByKind.get(ErrorKind.RESOURCE_EXHAUSTED).get(),
                droppedByRule.get(FilterRule.Kind.WILDCARD).get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;
        public final long accepted;
        public final long dropped;
        public final long errors;
        public final long timeouts;
        public final long resourceExhausted;
        public final long wildcardsDropped;

        public Snapshot(long r, long t, int c, long a,
                        long accepted, long dropped, long errors,
                        long timeouts, long resourceExhausted, long wildcardsDropped) {
            this.requestsTotal = r;
            this.retriesTotal = t;
            this.maxObservedConcurrency = c;
            this.avgLatencyMs = a;
            this.accepted = accepted;
            this.dropped = dropped;
            this.errors = errors;
            this.timeouts = timeouts;
            this.resourceExhausted = resourceExhausted;
            this.wildcardsDropped = wildcardsDropped;
        }
    }
}
