package io.fset.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ProjectDefaultsTest {

    private final Clock fixed = Clock.fixed(Instant.parse("2024-03-01T10:15:30.750Z"), ZoneOffset.UTC);

    @Test
    void default_key_uses_unix_seconds() {
        var defaults = new ProjectDefaults(fixed, () -> "a-1");
        assertEquals("project_1709288130", defaults.defaultKey());
    }

    @Test
    void timestamp_is_truncated_to_seconds() {
        var defaults = new ProjectDefaults(fixed, () -> "a-1");
        assertEquals(LocalDateTime.of(2024, 3, 1, 10, 15, 30), defaults.timestamp());
    }

    @Test
    void anchors_come_from_the_supplier() {
        var defaults = new ProjectDefaults(fixed, () -> "fixed-anchor");
        assertEquals("fixed-anchor", defaults.newAnchor());
        assertEquals(36, ProjectDefaults.system().newAnchor().length());
    }
}
