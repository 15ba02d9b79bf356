// file: core/src/main/java/io/fset/core/model/Fmodel.java
package io.fset.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A schema node stored under a file.
 * <p>
 * {@code sch} is an opaque nested document; it is stored and returned as-is.
 * {@code type} and {@code key} may be null.
 */
public record Fmodel(
        long id,
        String anchor,
        String type,
        String key,
        boolean isEntry,
        Map<String, Object> sch,
        long fileId
) {
    public Fmodel {
        Objects.requireNonNull(anchor, "anchor");
        sch = sch == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sch));
    }
}
