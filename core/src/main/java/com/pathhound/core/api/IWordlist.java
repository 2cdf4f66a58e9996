package com.pathhound.core.api;

/** 유한하고 재시작 가능한 워드 시퀀스. iterator() 마다 처음부터 다시 읽는다. */
public interface IWordlist extends Iterable<String> {
    /** 유효 항목 수(재개 호환성 판정에 사용) */
    int size();

    /** 사람이 읽는 식별자(파일 경로 등) */
    String identity();
}
