package com.pathhound.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScanResponseTest {

    private static HttpResponseData data(String url, int status, Map<String, List<String>> headers, String body) {
        return HttpResponseData.builder()
                .url(URI.create(url)).statusCode(status).headers(headers).body(body).build();
    }

    @Test
    void counts_are_derived_from_body() {
        ScanResponse r = ScanResponse.from(data("http://t/a", 200, Map.of(), "one two\n\nthree  four five\n"));

        assertThat(r.getLineCount()).isEqualTo(3);
        assertThat(r.getWordCount()).isEqualTo(5);
        assertThat(r.getContentLength()).isEqualTo(26);
    }

    @Test
    void content_length_takes_larger_of_header_and_body() {
        ScanResponse head = ScanResponse.from(data("http://t/a", 200,
                Map.of("Content-Length", List.of("1000")), "tiny"));
        ScanResponse bogus = ScanResponse.from(data("http://t/a", 200,
                Map.of("Content-Length", List.of("x")), "tiny"));

        assertThat(head.getContentLength()).isEqualTo(1000);
        assertThat(bogus.getContentLength()).isEqualTo(4);
        assertThat(head.header("CONTENT-LENGTH")).isEqualTo("1000");
    }

    @Test
    void redirect_to_slash_is_a_directory() {
        ScanResponse abs = ScanResponse.from(data("http://t/admin", 301,
                Map.of("Location", List.of("http://t/admin/")), ""));
        ScanResponse rel = ScanResponse.from(data("http://t/admin", 302,
                Map.of("Location", List.of("/admin/")), ""));
        ScanResponse elsewhere = ScanResponse.from(data("http://t/admin", 302,
                Map.of("Location", List.of("/login")), ""));

        assertThat(abs.isDirectory()).isTrue();
        assertThat(rel.isDirectory()).isTrue();
        assertThat(elsewhere.isDirectory()).isFalse();
    }

    @Test
    void slash_path_with_200_or_403_is_a_directory() {
        assertThat(ScanResponse.from(data("http://t/img/", 403, Map.of(), "")).isDirectory()).isTrue();
        assertThat(ScanResponse.from(data("http://t/img/", 404, Map.of(), "")).isDirectory()).isFalse();
        assertThat(ScanResponse.from(data("http://t/img", 200, Map.of(), "")).isDirectory()).isFalse();
    }

    @Test
    void base_directory_of_file_and_dir() {
        assertThat(ScanResponse.baseDirectoryOf(URI.create("http://t/a/b.php?x=1"))).isEqualTo("http://t/a/");
        assertThat(ScanResponse.baseDirectoryOf(URI.create("http://t/a/b/"))).isEqualTo("http://t/a/");
        assertThat(ScanResponse.baseDirectoryOf(URI.create("http://t/"))).isEqualTo("http://t/");
        assertThat(ScanResponse.baseDirectoryOf(URI.create("http://t"))).isEqualTo("http://t/");
    }

    @Test
    void extensionless_detection() {
        assertThat(ScanResponse.from(data("http://t/api", 200, Map.of(), "")).isExtensionless()).isTrue();
        assertThat(ScanResponse.from(data("http://t/a.js", 200, Map.of(), "")).isExtensionless()).isFalse();
        assertThat(ScanResponse.from(data("http://t/api?x", 200, Map.of(), "")).isExtensionless()).isFalse();
    }

    @Test
    void key_and_wildcard_copy() {
        ScanResponse r = ScanResponse.from(data("http://t/a", 200, Map.of(), "x"));
        ScanResponse w = r.withWildcard(true);

        assertThat(r.key()).isEqualTo("GET http://t/a");
        assertThat(w.isWildcard()).isTrue();
        assertThat(r.isWildcard()).isFalse();
        assertThat(w.getBody()).isEqualTo("x");
        assertThat(r.withWildcard(false)).isSameAs(r);
    }
}
