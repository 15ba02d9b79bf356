// file: core/src/main/java/io/fset/core/model/Project.java
package io.fset.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the document tree as loaded from storage.
 * <p>
 * Fields:
 *  - id:          storage-generated identity.
 *  - anchor:      stable opaque identifier, never rewritten after creation.
 *  - key:         short human-readable slug, unique across projects.
 *  - order:       display order.
 *  - description: optional free text (may be null).
 *  - files:       the project's files with their fmodels, in display order.
 */
public record Project(
        long id,
        String anchor,
        String key,
        int order,
        String description,
        List<ProjectFile> files
) {
    public Project {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(key, "key");
        files = files == null ? List.of() : List.copyOf(files);
    }

    /** Id/anchor pairs of the files currently owned by this project. */
    public List<FileRef> fileRefs() {
        List<FileRef> refs = new ArrayList<>(files.size());
        for (ProjectFile f : files) {
            refs.add(new FileRef(f.id(), f.anchor()));
        }
        return refs;
    }
}
