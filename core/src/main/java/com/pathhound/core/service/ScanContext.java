package com.pathhound.core.service;

import com.pathhound.core.api.IWordlist;
import com.pathhound.core.control.PauseController;
import com.pathhound.core.filter.FilterPipeline;
import com.pathhound.core.filter.FilterSet;
import com.pathhound.core.filter.WildcardDetector;
import com.pathhound.core.http.Requester;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.model.ScanStats;
import com.pathhound.core.scan.RecursionPolicy;
import com.pathhound.core.scan.ScanRegistry;
import com.pathhound.core.state.ResponseStore;
import com.pathhound.core.util.ResponseListener;
import com.pathhound.core.util.UrlExclusion;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/** 한 실행 동안 스캔 실행기들이 공유하는 컴포넌트 묶음 */
record ScanContext(RunConfig config,
                   IWordlist wordlist,
                   ScanRegistry registry,
                   Requester requester,
                   FilterSet filters,
                   FilterPipeline pipeline,
                   WildcardDetector wildcards,
                   RecursionPolicy recursion,
                   UrlExclusion exclusion,
                   ResponseStore store,
                   ResponseListener listener,
                   ScanStats stats,
                   PauseController pause,
                   AtomicBoolean shutdown) {

    /** 요청 경계에서의 중단 조건: 전역 종료 또는 스캔 취소 */
    boolean shouldStop(String scanId) {
        return shutdown.get() || registry.isCancelled(scanId);
    }

    /** 통과 응답 보고: 처음 보는 응답만 누적 + 리스너 통지 */
    void report(ScanResponse response) {
        if (!store.add(response)) return;
        stats.addAccepted();
        try {
            listener.onAccepted(response);
        } catch (RuntimeException e) {
            LoggerFactory.getLogger(ScanContext.class).warn("Response listener failed: {}", e.toString());
        }
    }
}
