package com.pathhound.core.model;

/** 스캔 종류: 시드(INITIAL) / 재귀 디렉터리(DIRECTORY) / 링크로 찾은 단일 리소스(FILE) */
public enum ScanType {
    INITIAL,
    DIRECTORY,
    FILE
}
