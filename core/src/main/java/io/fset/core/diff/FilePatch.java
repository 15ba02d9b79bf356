package io.fset.core.diff;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Translated file entry. {@code fmodels} holds entries nested under the file's
 * {@code fields}; it is empty for the usual flat diffs.
 */
public record FilePatch(
        String anchor,
        Optional<String> key,
        Optional<Integer> order,
        List<FmodelPatch> fmodels
) {
    public FilePatch {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(order, "order");
        fmodels = fmodels == null ? List.of() : List.copyOf(fmodels);
    }
}
