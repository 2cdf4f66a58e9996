package com.pathhound.core.error;

/** 상태 파일 읽기/쓰기 실패 */
public class StateFileException extends RuntimeException {
    public StateFileException(String message) { super(message); }
    public StateFileException(String message, Throwable cause) { super(message, cause); }
}
