package com.pathhound.core.state;

import com.pathhound.core.error.IncompatibleStateException;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.StateFile;
import com.pathhound.core.util.Wordlist;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeValidatorTest {

    private static StateFile saved(String wordlist, int entries, String... targets) {
        StateFile s = new StateFile();
        s.config = RunConfig.builder().targets(List.of(targets)).wordlist(wordlist).build();
        s.wordlistEntries = entries;
        return s;
    }

    @Test
    void same_targets_after_normalization_are_compatible() {
        StateFile s = saved("w.txt", 2, "http://T", "http://u/app");
        RunConfig cur = RunConfig.builder().targets(List.of("http://u/app/", "http://t/")).wordlist("w.txt").build();

        assertThatCode(() -> ResumeValidator.ensureCompatible(s, cur, Wordlist.of("a", "b")))
                .doesNotThrowAnyException();
    }

    @Test
    void empty_current_targets_adopt_saved_ones() {
        StateFile s = saved(null, 0, "http://t/");

        assertThatCode(() -> ResumeValidator.ensureCompatible(s, RunConfig.defaults(), Wordlist.of("a")))
                .doesNotThrowAnyException();
    }

    @Test
    void different_targets_are_fatal() {
        StateFile s = saved(null, 0, "http://t/");
        RunConfig cur = RunConfig.builder().target("http://other/").build();

        assertThatThrownBy(() -> ResumeValidator.ensureCompatible(s, cur, null))
                .isInstanceOf(IncompatibleStateException.class)
                .hasMessageContaining("targets");
    }

    @Test
    void different_wordlist_is_fatal() {
        RunConfig cur = RunConfig.builder().target("http://t/").wordlist("b.txt").build();

        assertThatThrownBy(() -> ResumeValidator.ensureCompatible(saved("a.txt", 0, "http://t/"), cur, null))
                .isInstanceOf(IncompatibleStateException.class)
                .hasMessageContaining("wordlist");
        assertThatThrownBy(() -> ResumeValidator.ensureCompatible(saved(null, 5, "http://t/"), cur, Wordlist.of("x")))
                .isInstanceOf(IncompatibleStateException.class)
                .hasMessageContaining("size");
    }
}
