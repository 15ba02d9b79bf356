// file: core/src/main/java/io/fset/core/model/ProjectFile.java
package io.fset.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A file inside a project. Owns an ordered list of fmodels.
 * {@code key} may be null for files that were inserted without one.
 */
public record ProjectFile(
        long id,
        String anchor,
        String key,
        int order,
        long projectId,
        List<Fmodel> fmodels
) {
    public ProjectFile {
        Objects.requireNonNull(anchor, "anchor");
        fmodels = fmodels == null ? List.of() : List.copyOf(fmodels);
    }
}
