package com.pathhound.core.model;

/** 실행 종료 사유 → 프로세스 종료 코드 */
public enum ExitStatus {
    COMPLETED(0),
    USER_CANCELLED(130),
    TIME_LIMIT(124),
    FATAL(1);

    private final int code;

    ExitStatus(int code) { this.code = code; }

    public int code() { return code; }
}
