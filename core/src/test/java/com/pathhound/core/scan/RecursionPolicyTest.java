package com.pathhound.core.scan;

import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.model.ScanStatus;
import com.pathhound.core.model.ScanType;
import com.pathhound.core.util.UrlExclusion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecursionPolicyTest {

    private ScanRegistry registry;
    private Scan root;

    @BeforeEach
    void setUp() {
        registry = new ScanRegistry(2, 1, 0);
        String id = registry.register("http://t/", ScanType.INITIAL, null, 0);
        root = registry.get(id).orElseThrow();
    }

    private static ScanResponse dir(String url) {
        return ScanResponse.from(HttpResponseData.builder().url(URI.create(url)).statusCode(200).build());
    }

    private RecursionPolicy policy(RunConfig cfg, List<String> dontScan) {
        return new RecursionPolicy(cfg, registry, UrlExclusion.compile(dontScan), List.of("http://t/"));
    }

    @Test
    void directory_is_registered_as_child() {
        RecursionPolicy p = policy(RunConfig.builder().maxDepth(2).build(), List.of());

        String id = p.consider(root, dir("http://t/admin/")).orElseThrow();

        Scan child = registry.get(id).orElseThrow();
        assertThat(child.getBaseUrl()).isEqualTo("http://t/admin/");
        assertThat(child.getParentId()).isEqualTo(root.getId());
        assertThat(child.getDepth()).isEqualTo(1);
        assertThat(child.getScanType()).isEqualTo(ScanType.DIRECTORY);
    }

    @Test
    void rejected_when_disabled_excluded_or_out_of_scope() {
        assertThat(policy(RunConfig.builder().noRecursion(true).build(), List.of())
                .consider(root, dir("http://t/a/"))).isEmpty();
        assertThat(policy(RunConfig.defaults(), List.of("/private"))
                .consider(root, dir("http://t/private/"))).isEmpty();
        assertThat(policy(RunConfig.defaults(), List.of())
                .consider(root, dir("http://cdn.other/a/"))).isEmpty();
    }

    @Test
    void extra_scope_domain_is_accepted() {
        RecursionPolicy p = policy(RunConfig.builder().scope(List.of("cdn.t")).build(), List.of());
        assertThat(p.scopeHosts()).containsExactlyInAnyOrder("t", "cdn.t");
        assertThat(p.consider(root, dir("http://cdn.t/x/"))).isPresent();
    }

    @Test
    void depth_beyond_max_is_rejected() {
        RecursionPolicy p = policy(RunConfig.builder().maxDepth(2).build(), List.of());
        Scan d1 = registry.get(p.consider(root, dir("http://t/a/")).orElseThrow()).orElseThrow();
        Scan d2 = registry.get(p.consider(d1, dir("http://t/a/b/")).orElseThrow()).orElseThrow();

        assertThat(p.consider(d2, dir("http://t/a/b/c/"))).isEmpty();
        assertThat(p.depthAllowed(2)).isTrue();
        assertThat(p.depthAllowed(3)).isFalse();
    }

    @Test
    void cancelled_parent_spawns_nothing() {
        RecursionPolicy p = policy(RunConfig.defaults(), List.of());
        registry.cancel(root.getId(), "user");
        assertThat(p.consider(root, dir("http://t/a/"))).isEmpty();
    }

    @Test
    void listing_page_is_recorded_complete_without_scanning() {
        RecursionPolicy p = policy(RunConfig.defaults(), List.of());
        ScanResponse listing = ScanResponse.from(HttpResponseData.builder()
                .url(URI.create("http://t/pub/")).statusCode(200)
                .body("<html><head><title>Index of /pub</title></head><body><a href=\"a.txt\">a.txt</a></body></html>")
                .build());

        Scan pub = registry.get(p.consider(root, listing).orElseThrow()).orElseThrow();
        Scan admin = registry.get(p.consider(root, dir("http://t/admin/")).orElseThrow()).orElseThrow();

        assertThat(pub.getStatus()).isEqualTo(ScanStatus.COMPLETE);
        assertThat(pub.getScanType()).isEqualTo(ScanType.DIRECTORY);
        assertThat(admin.getStatus()).isEqualTo(ScanStatus.QUEUED);
        // 본문을 이미 본 디렉터리는 시작 시 다시 확인하지 않는다
        assertThat(p.needsListingCheck(admin)).isFalse();
    }

    @Test
    void listing_is_scanned_when_enabled() {
        RecursionPolicy p = policy(RunConfig.builder().scanDirListings(true).build(), List.of());
        ScanResponse listing = ScanResponse.from(HttpResponseData.builder()
                .url(URI.create("http://t/pub/")).statusCode(200)
                .body("<h1>Directory listing for /pub/</h1>")
                .build());

        Scan pub = registry.get(p.consider(root, listing).orElseThrow()).orElseThrow();

        assertThat(pub.getStatus()).isEqualTo(ScanStatus.QUEUED);
        assertThat(p.needsListingCheck(pub)).isFalse();
    }

    @Test
    void redirect_found_directory_needs_listing_check() {
        RecursionPolicy p = policy(RunConfig.defaults(), List.of());
        ScanResponse redirect = ScanResponse.from(HttpResponseData.builder()
                .url(URI.create("http://t/img")).statusCode(301)
                .headers(Map.of("Location", List.of("http://t/img/")))
                .build());

        Scan img = registry.get(p.consider(root, redirect).orElseThrow()).orElseThrow();

        assertThat(img.getStatus()).isEqualTo(ScanStatus.QUEUED);
        assertThat(p.needsListingCheck(img)).isTrue();
        assertThat(p.needsListingCheck(root)).isFalse();
    }
}
