package com.pathhound.core.service;

import com.pathhound.core.crawler.LinkExtractor;
import com.pathhound.core.crawler.robots.RobotsFetcher;
import com.pathhound.core.filter.FilterDecision;
import com.pathhound.core.http.Requester;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.util.RateLimiter;
import com.pathhound.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 본문/robots.txt 에서 찾은 링크를 한 번씩 요청해 같은 필터 파이프라인에 태운다.
 * 통과한 디렉터리형 링크는 재귀 정책으로, 파일형 링크는 FILE 스캔(COMPLETE)으로 기록한다.
 * 요청한 링크는 실행 전체에서 한 번만 다룬다.
 */
final class LinkFollower {
    private static final Logger LOG = LoggerFactory.getLogger(LinkFollower.class);

    private final ScanContext ctx;
    private final LinkExtractor extractor;
    private final RobotsFetcher robots;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    LinkFollower(ScanContext ctx, LinkExtractor extractor, RobotsFetcher robots) {
        this.ctx = ctx;
        this.extractor = extractor;
        this.robots = robots;
    }

    void fromRobots(Scan scan, RateLimiter limiter, AutoTuner tuner) throws InterruptedException {
        drain(scan, robots.discover(URI.create(scan.getBaseUrl())), limiter, tuner);
    }

    void fromResponse(Scan scan, ScanResponse response, RateLimiter limiter, AutoTuner tuner)
            throws InterruptedException {
        drain(scan, extractor.extract(response), limiter, tuner);
    }

    /** 링크 요청 결과도 워드리스트 요청과 같은 창(auto-tune/bail)에 들어간다 */
    private void drain(Scan scan, Collection<URI> found, RateLimiter limiter, AutoTuner tuner)
            throws InterruptedException {
        Deque<URI> todo = new ArrayDeque<>(found);
        while (!todo.isEmpty()) {
            ctx.pause().awaitIfPaused();
            if (ctx.shouldStop(scan.getId())) return;

            URI link = todo.poll();
            if (!seen.add(UrlUtils.normalize(link).toString())) continue;
            if (ctx.exclusion().isExcluded(link) || !ctx.recursion().inScope(link)) continue;

            limiter.acquire();
            Requester.Outcome out = ctx.requester().get(link);
            ctx.stats().addAttempts(1L + out.retries());
            ctx.stats().addRetries(out.retries());
            tuner.record(AutoTuner.Outcome.of(out.data()));
            if (out.data().isError()) {
                ctx.stats().addError(out.data().getError());
                LOG.debug("Link request failed {}: {}", link, out.data().getErrorMessage());
                continue;
            }

            FilterDecision d = ctx.pipeline().classify(ScanResponse.from(out.data()), ctx.filters().snapshot());
            if (!d.accepted()) {
                ctx.stats().addDropped(d.droppedBy());
                continue;
            }
            ScanResponse accepted = d.response();
            ctx.report(accepted);

            // 취소된 스캔의 진행 중 결과로는 새 작업을 만들지 않는다
            if (ctx.shouldStop(scan.getId())) return;

            if (d.recurse()) {
                ctx.recursion().consider(scan, accepted);
            } else {
                int depth = scan.getDepth() + 1;
                if (ctx.recursion().depthAllowed(depth)) {
                    ctx.registry().registerFile(accepted.getUrl().toString(), scan.getId(), depth);
                }
            }
            todo.addAll(extractor.extract(accepted));
        }
    }
}
