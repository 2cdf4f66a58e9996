package com.pathhound.core.scan;

import com.pathhound.core.error.DepthExceededException;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanStatus;
import com.pathhound.core.model.ScanType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanRegistryTest {

    @Nested
    @DisplayName("등록")
    class Registration {
        @Test
        void depth_limit_is_enforced() {
            ScanRegistry r = new ScanRegistry(2, 4, 0);
            String root = r.register("http://t/", ScanType.INITIAL, null, 0);

            assertThat(r.get(root)).map(Scan::getStatus).contains(ScanStatus.QUEUED);
            assertThat(r.get(root)).map(Scan::getThreadCount).contains(4);
            assertThatThrownBy(() -> r.register("http://t/a/b/c/", ScanType.DIRECTORY, root, 3))
                    .isInstanceOf(DepthExceededException.class)
                    .hasMessageContaining("depth 3");
        }

        @Test
        void zero_max_depth_is_unlimited() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            String root = r.register("http://t/", ScanType.INITIAL, null, 0);
            r.register("http://t/deep/", ScanType.DIRECTORY, root, 99);
            assertThat(r.size()).isEqualTo(2);
        }

        @Test
        void unknown_parent_is_rejected() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            assertThatThrownBy(() -> r.register("http://t/a/", ScanType.DIRECTORY, "nope", 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void same_url_registers_once() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            String root = r.register("http://t/", ScanType.INITIAL, null, 0);

            assertThat(r.registerIfAbsent("http://t/admin/", ScanType.DIRECTORY, root, 1)).isPresent();
            assertThat(r.registerIfAbsent("http://T/admin", ScanType.DIRECTORY, root, 1)).isEmpty();
            assertThat(r.registerFile("http://t/admin/", root, 1)).isEmpty();
        }

        @Test
        void file_entries_are_recorded_complete() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            String root = r.register("http://t/", ScanType.INITIAL, null, 0);
            Optional<String> f = r.registerFile("http://t/robots.txt", root, 1);

            assertThat(f).isPresent();
            assertThat(r.get(f.get())).map(Scan::getStatus).contains(ScanStatus.COMPLETE);
            assertThat(r.hasQueued()).isTrue();
        }
    }

    @Nested
    @DisplayName("승인 / 상태 전이")
    class Admission {
        @Test
        void admits_fifo_up_to_limit() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            String a = r.register("http://a/", ScanType.INITIAL, null, 0);
            String b = r.register("http://b/", ScanType.INITIAL, null, 0);
            r.register("http://c/", ScanType.INITIAL, null, 0);

            assertThat(r.tryAdmit(2)).map(Scan::getId).contains(a);
            assertThat(r.tryAdmit(2)).map(Scan::getId).contains(b);
            assertThat(r.tryAdmit(2)).isEmpty();
            assertThat(r.activeCount()).isEqualTo(2);

            r.transition(a, ScanStatus.COMPLETE);
            assertThat(r.tryAdmit(2)).map(Scan::getBaseUrl).contains("http://c/");
        }

        @Test
        void paused_scans_hold_their_slot() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            r.register("http://a/", ScanType.INITIAL, null, 0);
            r.register("http://b/", ScanType.INITIAL, null, 0);
            r.tryAdmit(1);

            assertThat(r.pauseRunning()).isEqualTo(1);
            assertThat(r.tryAdmit(1)).isEmpty();
            assertThat(r.resumePaused()).isEqualTo(1);
        }

        @Test
        void illegal_transition_is_refused() {
            ScanRegistry r = new ScanRegistry(0, 1, 0);
            String a = r.register("http://a/", ScanType.INITIAL, null, 0);

            assertThat(r.transition(a, ScanStatus.COMPLETE)).isFalse();
            assertThat(r.cancel(a, "x")).isTrue();
            assertThat(r.transition(a, ScanStatus.RUNNING)).isFalse();
            assertThat(r.isCancelled(a)).isTrue();
            assertThat(r.get(a)).map(Scan::getCancelReason).contains("x");
            assertThat(r.isQuiescent()).isTrue();
        }
    }

    @Test
    void cancelTree_cancels_descendants_but_not_siblings() {
        ScanRegistry r = new ScanRegistry(0, 1, 0);
        String root = r.register("http://t/", ScanType.INITIAL, null, 0);
        String a = r.register("http://t/a/", ScanType.DIRECTORY, root, 1);
        String aa = r.register("http://t/a/a/", ScanType.DIRECTORY, a, 2);
        String b = r.register("http://t/b/", ScanType.DIRECTORY, root, 1);

        List<String> cancelled = r.cancelTree(a, "user");

        assertThat(cancelled).containsExactly(a, aa);
        assertThat(r.isCancelled(b)).isFalse();
        assertThat(r.isCancelled(root)).isFalse();
        assertThat(r.cancelableScans()).extracting(Scan::getId).containsExactly(b);
    }

    @Test
    void cancelAllActive_leaves_completed_alone() {
        ScanRegistry r = new ScanRegistry(0, 1, 0);
        String a = r.register("http://a/", ScanType.INITIAL, null, 0);
        r.register("http://b/", ScanType.INITIAL, null, 0);
        r.tryAdmit(0);
        r.transition(a, ScanStatus.COMPLETE);

        assertThat(r.cancelAllActive("time-limit")).isEqualTo(1);
        assertThat(r.counts()).containsEntry(ScanStatus.COMPLETE, 1).containsEntry(ScanStatus.CANCELLED, 1);
    }

    @Test
    void reseed_requeues_unfinished_and_keeps_order() {
        List<Scan> saved = List.of(
                new Scan("s2", "http://t/b/", ScanType.DIRECTORY, "s0", 1, 2, ScanStatus.CANCELLED, 3, 7, "user"),
                new Scan("s0", "http://t/", ScanType.INITIAL, null, 0, 0, ScanStatus.RUNNING, 3, 7, null),
                new Scan("s1", "http://t/a/", ScanType.DIRECTORY, "s0", 1, 1, ScanStatus.COMPLETE, 3, 7, null));
        ScanRegistry r = new ScanRegistry(0, 5, 0);

        r.reseed(saved);

        assertThat(r.snapshot()).extracting(Scan::getId).containsExactly("s0", "s1", "s2");
        assertThat(r.get("s1")).map(Scan::getStatus).contains(ScanStatus.COMPLETE);
        assertThat(r.get("s2")).map(Scan::getStatus).contains(ScanStatus.QUEUED);
        assertThat(r.get("s2")).map(Scan::getCancelReason).isEmpty();
        assertThat(r.get("s0")).map(Scan::getThreadCount).contains(5);

        String next = r.register("http://t/c/", ScanType.DIRECTORY, "s0", 1);
        assertThat(r.get(next)).map(Scan::getOrder).contains(3L);
    }

    @Test
    void updateTuning_is_visible_lock_free() {
        ScanRegistry r = new ScanRegistry(0, 8, 100);
        String a = r.register("http://a/", ScanType.INITIAL, null, 0);
        r.updateTuning(a, 4, 50);

        assertThat(r.currentThreads(a)).isEqualTo(4);
        assertThat(r.get(a)).map(Scan::getRateLimit).contains(50);
    }
}
