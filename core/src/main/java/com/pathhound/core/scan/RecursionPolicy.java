package com.pathhound.core.scan;

import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.model.ScanType;
import com.pathhound.core.util.UrlExclusion;
import com.pathhound.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 디렉터리로 보이는 통과 응답을 새 DIRECTORY 스캔으로 올릴지 결정한다.
 * 거절 사유: noRecursion, 부모 취소, dont-scan 제외, 범위 밖 호스트, 깊이 초과, 이미 등록됨.
 * 서버가 만든 디렉터리 목록 페이지는 scanDirListings 가 꺼져 있으면 COMPLETE 로만 기록한다.
 */
public final class RecursionPolicy {
    private static final Logger LOG = LoggerFactory.getLogger(RecursionPolicy.class);

    private final ScanRegistry registry;
    private final boolean noRecursion;
    private final boolean scanDirListings;
    private final int maxDepth;
    private final UrlExclusion exclusion;
    private final Set<String> scopeHosts;
    /** 본문으로 이미 목록 여부를 판정한 디렉터리 */
    private final Set<String> inspected = ConcurrentHashMap.newKeySet();

    public RecursionPolicy(RunConfig cfg, ScanRegistry registry, UrlExclusion exclusion, Collection<String> seedTargets) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.noRecursion = cfg.isNoRecursion();
        this.scanDirListings = cfg.isScanDirListings();
        this.maxDepth = cfg.getMaxDepth();
        this.exclusion = (exclusion == null ? UrlExclusion.NONE : exclusion);

        Set<String> hosts = new LinkedHashSet<>();
        for (String t : seedTargets) hosts.add(UrlUtils.hostOf(URI.create(t)));
        for (String extra : cfg.getScope()) {
            String h = extra.contains("://") ? UrlUtils.hostOf(URI.create(extra)) : extra.trim().toLowerCase(Locale.ROOT);
            if (!h.isEmpty()) hosts.add(h);
        }
        this.scopeHosts = Set.copyOf(hosts);
    }

    /**
     * @param parent   응답을 만든 스캔
     * @param response 필터를 통과했고 디렉터리로 보이는 응답
     * @return 새로 등록된 스캔 id (거절이면 empty)
     */
    public Optional<String> consider(Scan parent, ScanResponse response) {
        if (noRecursion) return Optional.empty();
        if (registry.isCancelled(parent.getId())) return Optional.empty();

        String target = UrlUtils.directoryBase(response.getUrl().toString());
        URI targetUri = URI.create(target);
        if (isExcluded(targetUri)) {
            LOG.debug("Recursion skipped (excluded): {}", target);
            return Optional.empty();
        }
        if (!inScope(targetUri)) {
            LOG.debug("Recursion skipped (out of scope): {}", target);
            return Optional.empty();
        }
        int depth = parent.getDepth() + 1;
        if (!depthAllowed(depth)) {
            LOG.debug("Recursion skipped (depth {} > {}): {}", depth, maxDepth, target);
            return Optional.empty();
        }
        boolean hasBody = response.getStatusCode() >= 200 && response.getStatusCode() < 300;
        if (!scanDirListings && hasBody) inspected.add(target);
        if (!scanDirListings && hasBody && DirectoryListing.isListing(response)) {
            Optional<String> listed = registry.registerListing(target, parent.getId(), depth);
            listed.ifPresent(x -> LOG.info("Directory listing recorded, not scanned: {}", target));
            return listed;
        }
        Optional<String> id = registry.registerIfAbsent(target, ScanType.DIRECTORY, parent.getId(), depth);
        id.ifPresent(x -> LOG.info("New directory scan queued: {} (depth {})", target, depth));
        return id;
    }

    /**
     * 리다이렉트로 찾은 디렉터리처럼 본문을 아직 못 본 경우 true.
     * 스캔 시작 전에 기본 URL 을 한 번 요청해 목록 페이지인지 확인해야 한다.
     */
    public boolean needsListingCheck(Scan scan) {
        return !scanDirListings
                && scan.getScanType() == ScanType.DIRECTORY
                && !inspected.contains(scan.getBaseUrl());
    }

    public boolean depthAllowed(int depth) {
        return maxDepth == 0 || depth <= maxDepth;
    }

    public boolean inScope(URI u) {
        return scopeHosts.contains(UrlUtils.hostOf(u));
    }

    public boolean isExcluded(URI u) {
        return exclusion.isExcluded(u);
    }

    public Set<String> scopeHosts() {
        return scopeHosts;
    }
}
