package com.pathhound.core.filter;

import com.pathhound.core.model.ScanResponse;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 파이프라인의 한 단계(태그드 변형). 평가 로직은 {@link #drops} 의 switch 한 곳에만 있다.
 *
 * <p>WILDCARD 는 규칙 자체가 아니라 스냅샷의 시그니처 맵을 보며,
 * 와일드카드 표시(dontFilter) 처리는 {@link FilterPipeline} 이 한다.</p>
 */
public final class FilterRule {

    /** 파이프라인 순서 그대로 선언 */
    public enum Kind {
        STATUS_DENY,
        STATUS_ALLOW,
        WILDCARD,
        SIZE,
        WORDS,
        LINES,
        REGEX,
        SIMILARITY
    }

    private final Kind kind;
    private final Set<Integer> statuses;
    private final Set<Long> values;
    private final List<Pattern> patterns;
    private final List<Long> hashes;
    private final double threshold;

    private FilterRule(Kind kind, Set<Integer> statuses, Set<Long> values,
                       List<Pattern> patterns, List<Long> hashes, double threshold) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statuses = statuses;
        this.values = values;
        this.patterns = patterns;
        this.hashes = hashes;
        this.threshold = threshold;
    }

    public static FilterRule statusDeny(Set<Integer> codes) {
        return new FilterRule(Kind.STATUS_DENY, Set.copyOf(codes), Set.of(), List.of(), List.of(), 0);
    }

    /** 빈 집합 = 모든 상태 허용 */
    public static FilterRule statusAllow(Set<Integer> codes) {
        return new FilterRule(Kind.STATUS_ALLOW, Set.copyOf(codes), Set.of(), List.of(), List.of(), 0);
    }

    public static FilterRule wildcard() {
        return new FilterRule(Kind.WILDCARD, Set.of(), Set.of(), List.of(), List.of(), 0);
    }

    public static FilterRule size(Set<Long> sizes) {
        return new FilterRule(Kind.SIZE, Set.of(), Set.copyOf(sizes), List.of(), List.of(), 0);
    }

    public static FilterRule words(Set<Long> counts) {
        return new FilterRule(Kind.WORDS, Set.of(), Set.copyOf(counts), List.of(), List.of(), 0);
    }

    public static FilterRule lines(Set<Long> counts) {
        return new FilterRule(Kind.LINES, Set.of(), Set.copyOf(counts), List.of(), List.of(), 0);
    }

    public static FilterRule regex(List<Pattern> patterns) {
        return new FilterRule(Kind.REGEX, Set.of(), Set.of(), List.copyOf(patterns), List.of(), 0);
    }

    public static FilterRule similarity(List<Long> simhashes, double threshold) {
        return new FilterRule(Kind.SIMILARITY, Set.of(), Set.of(), List.of(), List.copyOf(simhashes), threshold);
    }

    public Kind kind() { return kind; }

    /** 응답을 떨어뜨려야 하면 true (순수 함수) */
    public boolean drops(ScanResponse r, Map<String, WildcardSignature> signatures) {
        return switch (kind) {
            case STATUS_DENY -> statuses.contains(r.getStatusCode());
            case STATUS_ALLOW -> !statuses.isEmpty() && !statuses.contains(r.getStatusCode());
            case WILDCARD -> {
                WildcardSignature sig = signatures.get(r.getBaseDirectory());
                yield sig != null && sig.matches(r);
            }
            case SIZE -> values.contains(r.getContentLength());
            case WORDS -> values.contains(r.getWordCount());
            case LINES -> values.contains(r.getLineCount());
            case REGEX -> matchesAnyPattern(r);
            case SIMILARITY -> isSimilarToAny(r);
        };
    }

    /** 상태 코드 단계(1~2)만 평가: 와일드카드 프로브 판정용 */
    boolean dropsStatus(int status) {
        return switch (kind) {
            case STATUS_DENY -> statuses.contains(status);
            case STATUS_ALLOW -> !statuses.isEmpty() && !statuses.contains(status);
            default -> false;
        };
    }

    private boolean matchesAnyPattern(ScanResponse r) {
        for (Pattern p : patterns) {
            if (p.matcher(r.getBody()).find()) return true;
            for (Map.Entry<String, String> h : r.getHeaders().entrySet()) {
                if (p.matcher(h.getKey()).find() || p.matcher(h.getValue()).find()) return true;
            }
        }
        return false;
    }

    private boolean isSimilarToAny(ScanResponse r) {
        if (hashes.isEmpty()) return false;
        long h = SimHash.of(r.getBody());
        int cutoff = SimHash.maxDistance(threshold);
        for (long target : hashes) {
            if (SimHash.hamming(h, target) <= cutoff) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "FilterRule{" + kind + "}";
    }
}
