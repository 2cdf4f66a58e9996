package com.pathhound.core.util;

/**
 * 스캔 단위 leaky-bucket(토큰 버킷) 리미터.
 * <ul>
 *   <li>rate=0 이면 무제한(acquire 즉시 반환)</li>
 *   <li>초기 토큰 = round(rate/2), 상한 = rate, 초당 rate 만큼 보충</li>
 *   <li>{@link #setRate(int)} 로 런타임에 조정(auto-tune)</li>
 * </ul>
 */
public final class RateLimiter {
    private long capacity;
    private long refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(int rate) {
        this.lastNs = System.nanoTime();
        applyRate(rate);
        this.tokens = Math.round(rate / 2.0);
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            if (refillPerSecond <= 0) return; // 무제한
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    /** 현재 레이트(초당). 0 = 무제한 */
    public synchronized int getRate() {
        return (int) refillPerSecond;
    }

    public synchronized boolean isUnlimited() {
        return refillPerSecond <= 0;
    }

    /** 레이트 변경. 토큰은 새 상한으로 잘린다. */
    public synchronized void setRate(int rate) {
        refill();
        applyRate(rate);
        tokens = Math.min(tokens, capacity);
        this.notifyAll();
    }

    private void applyRate(int rate) {
        int r = Math.max(0, rate);
        this.capacity = r;
        this.refillPerSecond = r;
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        } else if (refillPerSecond <= 0) {
            lastNs = now;
        }
    }
}
