package com.pathhound.core.model;

/**
 * 스캔 라이프사이클 상태.
 * <pre>
 * QUEUED  → RUNNING | CANCELLED
 * RUNNING → PAUSED | COMPLETE | CANCELLED
 * PAUSED  → RUNNING | COMPLETE | CANCELLED
 * </pre>
 * CANCELLED / COMPLETE 는 종단 상태(더 이상 전이 없음).
 */
public enum ScanStatus {
    QUEUED,
    RUNNING,
    PAUSED,
    CANCELLED,
    COMPLETE;

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETE;
    }

    /** RUNNING + PAUSED 는 scan-limit 슬롯을 점유한다. */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean canTransitionTo(ScanStatus next) {
        if (next == null || isTerminal()) return false;
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == PAUSED || next == COMPLETE || next == CANCELLED;
            case PAUSED -> next == RUNNING || next == COMPLETE || next == CANCELLED;
            default -> false;
        };
    }
}
