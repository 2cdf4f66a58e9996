package com.pathhound.core.state;

import com.pathhound.core.model.ScanResponse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 통과 응답 누적 버퍼(METHOD + URL 기준 중복 제거, 입력 순 유지).
 * 본문은 보관하지 않는다.
 */
public final class ResponseStore {
    private final LinkedHashMap<String, ScanResponse> byKey = new LinkedHashMap<>();

    /** 새 응답이면 저장 후 true(=보고 대상) */
    public synchronized boolean add(ScanResponse r) {
        if (byKey.containsKey(r.key())) return false;
        byKey.put(r.key(), r.toBuilder().body(null).build());
        return true;
    }

    /** 재개 시 이전 응답 적재(보고하지 않음) */
    public synchronized void preload(Collection<ScanResponse> saved) {
        if (saved == null) return;
        for (ScanResponse r : saved) byKey.putIfAbsent(r.key(), r);
    }

    public synchronized boolean contains(ScanResponse r) {
        return byKey.containsKey(r.key());
    }

    public synchronized List<ScanResponse> all() {
        return new ArrayList<>(byKey.values());
    }

    public synchronized int size() {
        return byKey.size();
    }
}
