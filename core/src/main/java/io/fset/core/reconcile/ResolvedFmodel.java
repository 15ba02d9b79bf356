package io.fset.core.reconcile;

import io.fset.core.diff.FmodelPatch;

import java.util.Objects;

/**
 * An fmodel patch whose parent file has been found.
 * The patch no longer carries the parent marker in its payload.
 */
public record ResolvedFmodel(FmodelPatch patch, long fileId) {
    public ResolvedFmodel {
        Objects.requireNonNull(patch, "patch");
    }
}
