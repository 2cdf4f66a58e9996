package com.pathhound.core.crawler.robots;

import com.pathhound.core.http.Requester;
import com.pathhound.core.model.HttpResponseData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** 타깃 오리진의 /robots.txt 를 받아 발견 경로를 절대 URL 로 돌려준다. */
public final class RobotsFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(RobotsFetcher.class);

    private final Requester requester;

    public RobotsFetcher(Requester requester) {
        this.requester = Objects.requireNonNull(requester, "requester");
    }

    public Set<URI> discover(URI target) throws InterruptedException {
        Set<URI> out = new LinkedHashSet<>();
        String origin = target.getScheme() + "://" + target.getRawAuthority();
        URI robots = URI.create(origin + "/robots.txt");

        HttpResponseData data = requester.get(robots).data();
        if (data.isError() || data.getStatusCode() < 200 || data.getStatusCode() >= 300) {
            LOG.debug("robots.txt unavailable at {} (status {})", robots, data.getStatusCode());
            return out;
        }
        RobotsParser.ParsedRobots parsed = RobotsParser.parse(data.getBody());
        for (String path : parsed.discoveredPaths()) {
            try {
                out.add(URI.create(origin + path));
            } catch (IllegalArgumentException e) {
                LOG.debug("Skipping robots path {}: {}", path, e.getMessage());
            }
        }
        // 같은 origin 의 sitemap 만
        for (String sm : parsed.sitemaps()) {
            try {
                URI u = URI.create(sm);
                if (origin.equalsIgnoreCase(u.getScheme() + "://" + u.getRawAuthority())) out.add(u);
            } catch (IllegalArgumentException e) {
                LOG.debug("Skipping sitemap {}: {}", sm, e.getMessage());
            }
        }
        LOG.info("robots.txt at {} listed {} paths", robots, out.size());
        return out;
    }
}
