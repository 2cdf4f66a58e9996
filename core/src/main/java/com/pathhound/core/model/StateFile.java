package com.pathhound.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** 체크포인트 파일 포맷 (v=1) */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StateFile {
    public String v = "1";                                 // 스키마 버전
    public Instant savedAt;                                // 저장 시각
    public int wordlistEntries;                            // 워드리스트 식별(항목 수)
    public List<Scan> scans = new ArrayList<>();           // 레지스트리 스냅샷(등록 순)
    public RunConfig config;                               // 실행 설정
    public List<ScanResponse> responses = new ArrayList<>(); // 누적된 통과 응답
}
