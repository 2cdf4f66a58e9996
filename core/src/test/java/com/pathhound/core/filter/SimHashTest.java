package com.pathhound.core.filter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimHashTest {

    @Test
    void identical_text_is_fully_similar() {
        long a = SimHash.of("the page you requested was not found");
        assertThat(SimHash.similarity(a, SimHash.of("the page you requested was not found"))).isEqualTo(1.0);
    }

    @Test
    void markup_is_ignored() {
        long html = SimHash.of("<html><body><h1>Not Found</h1><p>sorry</p></body></html>");
        long text = SimHash.of("not found sorry");
        assertThat(html).isEqualTo(text);
    }

    @Test
    void blank_body_hashes_to_zero() {
        assertThat(SimHash.of("")).isZero();
        assertThat(SimHash.of("   \n")).isZero();
        assertThat(SimHash.of(null)).isZero();
    }

    @Test
    void hamming_and_similarity() {
        assertThat(SimHash.hamming(0L, 0xFFL)).isEqualTo(8);
        assertThat(SimHash.similarity(0L, 0L)).isEqualTo(1.0);
        assertThat(SimHash.similarity(0L, (1L << SimHash.NEAR_DUPLICATE_DISTANCE) - 1))
                .isCloseTo(0.95, within(1e-9));
        assertThat(SimHash.similarity(0L, -1L)).isLessThan(SimHash.similarity(0L, 0xFFL));
    }

    @Test
    void threshold_maps_to_hamming_cutoff() {
        assertThat(SimHash.maxDistance(0.95)).isEqualTo(SimHash.NEAR_DUPLICATE_DISTANCE);
        assertThat(SimHash.maxDistance(1.0)).isZero();
        assertThat(SimHash.maxDistance(0.9)).isEqualTo(28);
        assertThat(SimHash.maxDistance(0.0)).isEqualTo(64);
    }

    @Test
    void punctuation_case_and_stop_words_are_dropped() {
        assertThat(SimHash.tokens("The requested URL /uploads/Old.PHP was NOT found!"))
                .containsExactly("requested", "url", "uploads", "old", "php", "found");
    }
}
