package com.pathhound.core.crawler.robots;

import com.pathhound.core.http.DefaultRetryPolicy;
import com.pathhound.core.http.Requester;
import com.pathhound.core.model.HttpResponseData;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RobotsParserTest {

    private static final String ROBOTS = """
            # group 1: Alpha & Beta
            User-agent: AlphaBot
            User-agent: BetaBot
            Disallow: /private
            Allow: /public$

            # star group
            User-agent: *
            Disallow: /tmp/
            Disallow: /admin/*.php
            Disallow: /private
            Disallow:
            Disallow: /
            Sitemap: https://ex.com/sitemap.xml
            """;

    @Test
    void discoveredPaths_merges_groups_and_trims_wildcards() {
        Set<String> paths = RobotsParser.parse(ROBOTS).discoveredPaths();

        assertEquals(List.of("/public", "/private", "/tmp/", "/admin/"), new ArrayList<>(paths));
    }

    @Test
    void consecutive_user_agents_share_one_group() {
        RobotsParser.ParsedRobots parsed = RobotsParser.parse(ROBOTS);

        assertEquals(1, parsed.byUa().get("alphabot").disallow.size());
        assertEquals(parsed.byUa().get("alphabot").disallow, parsed.byUa().get("betabot").disallow);
        assertTrue(parsed.byUa().containsKey("*"));
    }

    @Test
    void sitemaps_are_collected_outside_groups() {
        RobotsParser.ParsedRobots parsed = RobotsParser.parse(ROBOTS + "sitemap: https://ex.com/news.xml\n");

        assertEquals(List.of("https://ex.com/sitemap.xml", "https://ex.com/news.xml"), parsed.sitemaps());
        assertFalse(parsed.discoveredPaths().contains("/sitemap.xml"));
    }

    @Test
    void fetcher_keeps_same_origin_sitemap_only() throws Exception {
        String robots = "Sitemap: http://ex.com/sitemap.xml\nSitemap: http://cdn.ex.com/other.xml\n";
        Requester requester = new Requester((url, method, headers) ->
                HttpResponseData.builder().url(url).statusCode(200).body(robots).build(),
                new DefaultRetryPolicy(1, 1), d -> {});

        Set<URI> found = new RobotsFetcher(requester).discover(URI.create("http://ex.com/"));

        assertEquals(Set.of(URI.create("http://ex.com/sitemap.xml")), found);
    }

    @Test
    void rules_before_any_user_agent_go_to_star() {
        Set<String> paths = RobotsParser.parse("Disallow: /early\n").discoveredPaths();
        assertEquals(Set.of("/early"), paths);
    }

    @Test
    void empty_or_null_input() {
        assertTrue(RobotsParser.parse(null).discoveredPaths().isEmpty());
        assertTrue(RobotsParser.parse("").discoveredPaths().isEmpty());
    }

    @Test
    void fetcher_resolves_paths_against_origin() throws Exception {
        Requester requester = new Requester((url, method, headers) -> {
            int status = url.getRawPath().equals("/robots.txt") ? 200 : 404;
            return HttpResponseData.builder().url(url).statusCode(status).body(status == 200 ? ROBOTS : "").build();
        }, new DefaultRetryPolicy(1, 1), d -> {});

        Set<URI> found = new RobotsFetcher(requester).discover(URI.create("https://ex.com:8443/app/"));

        assertTrue(found.contains(URI.create("https://ex.com:8443/admin/")));
        assertTrue(found.contains(URI.create("https://ex.com:8443/tmp/")));
        assertEquals(4, found.size());
    }

    @Test
    void fetcher_returns_nothing_when_robots_missing() throws Exception {
        Requester requester = new Requester(
                (url, method, headers) -> HttpResponseData.builder().url(url).statusCode(404).build(),
                new DefaultRetryPolicy(1, 1), d -> {});

        assertTrue(new RobotsFetcher(requester).discover(URI.create("http://ex.com/")).isEmpty());
    }
}
