package com.pathhound.core.filter;

import com.pathhound.core.api.IHttpTransport;
import com.pathhound.core.error.InvalidFilterException;
import com.pathhound.core.model.ErrorKind;
import com.pathhound.core.model.HttpResponseData;
import com.pathhound.core.model.RunConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterSetFactoryTest {

    @Test
    void default_rules_in_pipeline_order() {
        FilterSet fs = FilterSetFactory.create(RunConfig.defaults(), null);

        assertThat(fs.rules()).extracting(FilterRule::kind)
                .containsExactly(FilterRule.Kind.STATUS_ALLOW, FilterRule.Kind.WILDCARD);
        assertThat(fs.passesStatus(200)).isTrue();
        assertThat(fs.passesStatus(404)).isFalse();
        assertThat(fs.wildcardCount()).isZero();
    }

    @Test
    void conflicting_allow_and_deny_is_fatal() {
        RunConfig cfg = RunConfig.builder()
                .statusCodes(List.of(200, 403))
                .filterStatus(List.of(403))
                .build();

        assertThatThrownBy(() -> FilterSetFactory.create(cfg, null))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("403");
    }

    @Test
    void invalid_regex_is_fatal() {
        RunConfig cfg = RunConfig.builder().filterRegex(List.of("[unclosed")).build();

        assertThatThrownBy(() -> FilterSetFactory.create(cfg, null))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("[unclosed");
    }

    @Test
    void similarity_targets_are_fetched_once() {
        int[] calls = {0};
        IHttpTransport transport = (url, method, headers) -> {
            calls[0]++;
            return HttpResponseData.builder().url(url).statusCode(200).body("<h1>Not Found</h1><p>sorry</p>").build();
        };
        RunConfig cfg = RunConfig.builder().filterSimilarTo(List.of("http://t/404page")).build();

        FilterSet fs = FilterSetFactory.create(cfg, transport);

        assertThat(calls[0]).isEqualTo(1);
        assertThat(fs.rules()).extracting(FilterRule::kind).contains(FilterRule.Kind.SIMILARITY);
    }

    @Test
    void unreachable_similarity_target_is_skipped() {
        IHttpTransport transport = (url, method, headers) ->
                HttpResponseData.failure(url, method, ErrorKind.CONNECTION, "refused", 1);
        RunConfig cfg = RunConfig.builder().filterSimilarTo(List.of("http://t/404page")).build();

        FilterSet fs = FilterSetFactory.create(cfg, transport);

        assertThat(fs.rules()).extracting(FilterRule::kind).doesNotContain(FilterRule.Kind.SIMILARITY);
    }

    @Test
    void wildcard_signature_is_add_only() {
        FilterSet fs = FilterSetFactory.create(RunConfig.defaults(), null);
        FilterSet.Snapshot before = fs.snapshot();

        assertThat(fs.addWildcard("http://t/", WildcardSignature.fixed(200, 10))).isTrue();
        assertThat(fs.addWildcard("http://t/", WildcardSignature.fixed(200, 99))).isFalse();

        assertThat(fs.wildcardFor("http://t/")).map(WildcardSignature::length).contains(10L);
        assertThat(before.signatures()).isEmpty();
        assertThat(fs.snapshot().signatures()).containsKey("http://t/");
    }
}
