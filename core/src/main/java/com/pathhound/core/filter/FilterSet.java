package com.pathhound.core.filter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 정적 규칙(설정에서 한 번 생성) + 디렉터리별 와일드카드 서명(추가만 가능).
 *
 * <p>워커는 요청마다 {@link #snapshot()} 으로 불변 스냅샷을 받아 분류한다.
 * 서명이 추가될 때만 스냅샷을 새로 만든다.</p>
 */
public final class FilterSet {

    /** 분류 입력용 불변 스냅샷 */
    public record Snapshot(List<FilterRule> rules, Map<String, WildcardSignature> signatures, boolean dontFilter) {}

    private final List<FilterRule> rules;
    private final boolean dontFilter;
    private final ConcurrentHashMap<String, WildcardSignature> signatures = new ConcurrentHashMap<>();
    private volatile Snapshot current;

    public FilterSet(List<FilterRule> rules, boolean dontFilter) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.dontFilter = dontFilter;
        this.current = new Snapshot(this.rules, Map.of(), dontFilter);
    }

    public Snapshot snapshot() {
        return current;
    }

    public List<FilterRule> rules() {
        return rules;
    }

    public boolean isDontFilter() {
        return dontFilter;
    }

    /**
     * 디렉터리 서명 등록. 이미 있으면 기존 서명을 유지하고 false.
     * @param baseDirectory '/' 로 끝나는 디렉터리 URL
     */
    public synchronized boolean addWildcard(String baseDirectory, WildcardSignature signature) {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        Objects.requireNonNull(signature, "signature");
        if (signatures.putIfAbsent(baseDirectory, signature) != null) return false;
        current = new Snapshot(rules, Map.copyOf(signatures), dontFilter);
        return true;
    }

    public Optional<WildcardSignature> wildcardFor(String baseDirectory) {
        return Optional.ofNullable(signatures.get(baseDirectory));
    }

    public int wildcardCount() {
        return signatures.size();
    }

    /** 상태 코드 단계(deny/allow)를 통과하는지 */
    public boolean passesStatus(int status) {
        for (FilterRule r : rules) {
            if (r.dropsStatus(status)) return false;
        }
        return true;
    }
}
