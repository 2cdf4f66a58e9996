package com.pathhound.core.model;

/** 요청 단위 전송 오류 분류 (HTTP 상태 코드가 아니라 네트워크 레벨) */
public enum ErrorKind {
    TIMEOUT,
    CONNECTION,
    /** "Too many open files" 등 로컬 자원 고갈 */
    RESOURCE_EXHAUSTED,
    OTHER
}
