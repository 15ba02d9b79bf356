// file: core/src/main/java/io/fset/core/ProjectDefaults.java
package io.fset.core;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Source of generated values: default project keys, fresh anchors and
 * row timestamps.
 * <p>
 * Both the clock and the anchor supplier are injected so tests can pin them.
 */
public final class ProjectDefaults {

    private final Clock clock;
    private final Supplier<String> anchors;

    public ProjectDefaults(Clock clock, Supplier<String> anchors) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.anchors = Objects.requireNonNull(anchors, "anchors");
    }

    /** UTC wall clock and random UUID anchors. */
    public static ProjectDefaults system() {
        return new ProjectDefaults(Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    /** Default project key: {@code project_<unix seconds>}. */
    public String defaultKey() {
        return "project_" + clock.instant().getEpochSecond();
    }

    public String newAnchor() {
        return anchors.get();
    }

    /** Current UTC time truncated to whole seconds. */
    public LocalDateTime timestamp() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
    }
}
