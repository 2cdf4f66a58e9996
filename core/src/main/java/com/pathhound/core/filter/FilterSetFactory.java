package com.pathhound.core.filter;

import com.pathhound.core.api.IHttpTransport;
import com.pathhound.core.error.InvalidFilterException;
import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * RunConfig → FilterSet.
 * <ul>
 *   <li>정규식 컴파일 실패, allow/deny 목록 충돌 → {@link InvalidFilterException} (치명적)</li>
 *   <li>deny 만 주고 allow 를 생략하면 allow 는 "전체"</li>
 *   <li>similarity 대상 URL 은 시작 시 한 번 받아 SimHash 로 저장(실패 시 경고 후 제외)</li>
 * </ul>
 */
public final class FilterSetFactory {
    private static final Logger LOG = LoggerFactory.getLogger(FilterSetFactory.class);
    private static final StructuredLog SLOG = StructuredLog.get(FilterSetFactory.class);

    private FilterSetFactory() {}

    public static FilterSet create(RunConfig cfg, IHttpTransport transport) {
        List<FilterRule> rules = new ArrayList<>();

        Set<Integer> deny = new LinkedHashSet<>(cfg.getFilterStatus());
        Set<Integer> allow;
        if (cfg.getStatusCodes() != null) {
            allow = new LinkedHashSet<>(cfg.getStatusCodes());
            Set<Integer> both = new LinkedHashSet<>(allow);
            both.retainAll(deny);
            if (!both.isEmpty()) {
                throw new InvalidFilterException("status codes both allowed and denied: " + both);
            }
        } else if (!deny.isEmpty()) {
            allow = Set.of(); // 전체 허용
        } else {
            allow = new LinkedHashSet<>(RunConfig.DEFAULT_STATUS_CODES);
        }

        if (!deny.isEmpty()) rules.add(FilterRule.statusDeny(deny));
        rules.add(FilterRule.statusAllow(allow));
        rules.add(FilterRule.wildcard());
        if (!cfg.getFilterSize().isEmpty()) rules.add(FilterRule.size(Set.copyOf(cfg.getFilterSize())));
        if (!cfg.getFilterWords().isEmpty()) rules.add(FilterRule.words(Set.copyOf(cfg.getFilterWords())));
        if (!cfg.getFilterLines().isEmpty()) rules.add(FilterRule.lines(Set.copyOf(cfg.getFilterLines())));

        if (!cfg.getFilterRegex().isEmpty()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String rx : cfg.getFilterRegex()) {
                try {
                    patterns.add(Pattern.compile(rx));
                } catch (PatternSyntaxException e) {
                    throw new InvalidFilterException("invalid filter regex: " + rx, e);
                }
            }
            rules.add(FilterRule.regex(patterns));
        }

        if (!cfg.getFilterSimilarTo().isEmpty()) {
            List<Long> hashes = fetchSimilarityTargets(cfg.getFilterSimilarTo(), cfg.getHeaders(), transport);
            if (!hashes.isEmpty()) rules.add(FilterRule.similarity(hashes, cfg.getSimilarityThreshold()));
        }

        SLOG.info("filters-ready",
                "rules", rules.size(),
                "allow", allow.isEmpty() ? "all" : String.valueOf(allow),
                "deny", String.valueOf(deny),
                "dontFilter", cfg.isDontFilter());
        return new FilterSet(rules, cfg.isDontFilter());
    }

    private static List<Long> fetchSimilarityTargets(List<String> urls, Map<String, String> headers,
                                                     IHttpTransport transport) {
        List<Long> out = new ArrayList<>();
        for (String u : urls) {
            URI uri;
            try {
                uri = URI.create(u.trim());
            } catch (IllegalArgumentException e) {
                throw new InvalidFilterException("invalid similarity target: " + u, e);
            }
            if (transport == null) {
                LOG.warn("No transport to fetch similarity target {}, skipped", uri);
                continue;
            }
            HttpResponseData data = transport.send(uri, "GET", headers);
            if (data.isError()) {
                LOG.warn("Similarity target {} could not be fetched ({}), skipped", uri, data.getError());
                continue;
            }
            out.add(SimHash.of(data.getBody()));
        }
        return out;
    }
}
