package com.pathhound.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunConfigTest {

    @Test
    void defaults_are_valid() {
        RunConfig cfg = RunConfig.defaults();
        assertEquals(50, cfg.getThreads());
        assertEquals(0, cfg.getScanLimit());
        assertEquals(2, cfg.getRetryAttempts());
        assertNull(cfg.getStatusCodes());
        assertTrue(cfg.isRecurseExtensionless());
        assertFalse(cfg.hasTimeLimit());
    }

    @Test
    void validate_fail_whenRecursionFlagsConflict() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> RunConfig.builder().forceRecursion(true).noRecursion(true).build());
        assertTrue(ex.getMessage().contains("mutually exclusive"));
    }

    @Test
    void validate_fail_whenRatiosOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> RunConfig.builder().bailErrorRatio(0).build());
        assertThrows(IllegalArgumentException.class, () -> RunConfig.builder().similarityThreshold(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> RunConfig.builder().wildcardTolerance(1.0).build());
    }

    @Test
    void validate_fail_whenTargetNotHttp() {
        assertThrows(IllegalArgumentException.class, () -> RunConfig.builder().target("example.com").build());
        assertThrows(IllegalArgumentException.class, () -> RunConfig.builder().target("ftp://example.com").build());
        assertDoesNotThrow(() -> RunConfig.builder().target("HTTPS://example.com/app").build());
    }

    @Test
    void toBuilder_copies_and_lists_are_immutable() {
        RunConfig a = RunConfig.builder().target("http://t/").filterSize(List.of(10L)).timeLimit(Duration.ofSeconds(5)).build();
        RunConfig b = a.toBuilder().threads(3).build();

        assertEquals(a.getTargets(), b.getTargets());
        assertEquals(a.getFilterSize(), b.getFilterSize());
        assertEquals(3, b.getThreads());
        assertTrue(b.hasTimeLimit());
        assertThrows(UnsupportedOperationException.class, () -> a.getTargets().add("http://x/"));
    }
}
