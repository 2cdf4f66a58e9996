package com.pathhound.core.error;

/** 필터 설정 오류(잘못된 정규식, allow/deny 충돌). 시작 시 치명적. */
public class InvalidFilterException extends RuntimeException {
    public InvalidFilterException(String message) { super(message); }
    public InvalidFilterException(String message, Throwable cause) { super(message, cause); }
}
