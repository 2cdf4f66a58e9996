package com.pathhound.core.error;

/** 저장된 상태와 현재 실행 설정(타깃/워드리스트)이 맞지 않음 */
public class IncompatibleStateException extends StateFileException {
    public IncompatibleStateException(String message) { super(message); }
}
