package com.pathhound.core.crawler;

import com.pathhound.core.model.ScanResponse;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupLinkExtractorTest {

    private final LinkExtractor extractor = new JsoupLinkExtractor();

    private static ScanResponse page(String url, String contentType, String body) {
        return ScanResponse.builder()
                .url(URI.create(url))
                .statusCode(200)
                .headers(contentType == null ? Map.of() : Map.of("content-type", contentType))
                .body(body)
                .build();
    }

    @Test
    void html_attributes_and_parents_same_host_only() {
        String html = """
                <html><head>
                  <link rel="stylesheet" href="/static/css/site.css">
                  <script src="//t/js/app.js"></script>
                </head><body>
                  <a href="admin/users.php#top">users</a>
                  <img src="http://other.com/logo.png">
                  <a href="mailto:root@t">mail</a>
                  <form action="/login"></form>
                </body></html>
                """;

        Set<URI> links = extractor.extract(page("http://t/app/index.html", "text/html; charset=utf-8", html));

        assertThat(links).contains(
                URI.create("http://t/static/css/site.css"),
                URI.create("http://t/static/css/"),
                URI.create("http://t/static/"),
                URI.create("http://t/js/app.js"),
                URI.create("http://t/app/admin/users.php"),
                URI.create("http://t/app/admin/"),
                URI.create("http://t/login"));
        assertThat(links).noneMatch(u -> "other.com".equals(u.getHost()));
        assertThat(links).noneMatch(u -> "mailto".equals(u.getScheme()));
        assertThat(links).doesNotContain(URI.create("http://t/"));
    }

    @Test
    void quoted_paths_inside_scripts() {
        String js = "fetch(\"/api/v1/items?page=2\"); var cfg = { url: '/internal/health' };";

        Set<URI> links = extractor.extract(page("http://t/bundle.js", "application/javascript", js));

        assertThat(links).contains(
                URI.create("http://t/api/v1/items?page=2"),
                URI.create("http://t/api/v1/"),
                URI.create("http://t/api/"),
                URI.create("http://t/internal/health"));
    }

    @Test
    void empty_body_yields_nothing() {
        assertThat(extractor.extract(page("http://t/", null, ""))).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void parents_stop_before_root() {
        Set<URI> out = new LinkedHashSet<>();
        JsoupLinkExtractor.addWithParents(URI.create("http://t/a/b/c.js"), out);

        assertThat(out).containsExactly(
                URI.create("http://t/a/b/c.js"),
                URI.create("http://t/a/b/"),
                URI.create("http://t/a/"));
    }
}
