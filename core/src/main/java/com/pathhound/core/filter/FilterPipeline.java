package com.pathhound.core.filter;

import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.ScanResponse;

import java.util.Objects;

/**
 * 순서가 있는 단락(short-circuit) 필터 체인:
 * status deny → status allow → wildcard → size/word/line → regex → similarity.
 *
 * <p>{@link #classify} 는 (응답, 스냅샷) 에 대한 순수 함수다. 같은 입력이면 항상 같은 결정.</p>
 */
public final class FilterPipeline {

    private final boolean forceRecursion;
    private final boolean recurseExtensionless;

    public FilterPipeline(boolean forceRecursion, boolean recurseExtensionless) {
        this.forceRecursion = forceRecursion;
        this.recurseExtensionless = recurseExtensionless;
    }

    public static FilterPipeline from(RunConfig cfg) {
        return new FilterPipeline(cfg.isForceRecursion(), cfg.isRecurseExtensionless());
    }

    public FilterDecision classify(ScanResponse response, FilterSet.Snapshot snapshot) {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(snapshot, "snapshot");

        ScanResponse cur = response;
        for (FilterRule rule : snapshot.rules()) {
            if (!rule.drops(cur, snapshot.signatures())) continue;

            if (rule.kind() == FilterRule.Kind.WILDCARD && snapshot.dontFilter()) {
                // 필터 비활성: 표시만 하고 계속 진행
                cur = cur.withWildcard(true);
                continue;
            }
            return FilterDecision.drop(rule.kind(), cur);
        }
        // 와일드카드로 표시된 응답은 재귀하지 않는다
        return FilterDecision.accept(cur, !cur.isWildcard() && looksLikeDirectory(cur));
    }

    /** 재귀 후보로 볼 만한 응답인지 (범위/깊이 판단은 RecursionPolicy 몫) */
    public boolean looksLikeDirectory(ScanResponse r) {
        if (forceRecursion) return true;
        if (r.isDirectory()) return true;
        if (!recurseExtensionless || !r.isExtensionless()) return false;
        int s = r.getStatusCode();
        return (s >= 200 && s < 400) || s == 401 || s == 403;
    }
}
