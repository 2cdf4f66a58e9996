package com.pathhound.core.service;

import com.pathhound.core.model.ExitStatus;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.model.ScanStats;

import java.nio.file.Path;
import java.util.List;

/**
 * 실행 결과 요약.
 * @param stateFile 마지막으로 쓴 체크포인트(없으면 null)
 */
public record RunOutcome(ExitStatus exitStatus,
                         ScanStats.Snapshot stats,
                         List<ScanResponse> responses,
                         List<Scan> scans,
                         Path stateFile) {}
