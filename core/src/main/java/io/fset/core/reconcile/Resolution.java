package io.fset.core.reconcile;

import io.fset.core.diff.FmodelPatch;

import java.util.List;

/**
 * Outcome of parent resolution for a batch of fmodels:
 *  - Resolved: every fmodel found its parent file.
 *  - Unresolved: the first fmodel whose parent is unknown; nothing of the batch may be stored.
 */
public sealed interface Resolution permits Resolution.Resolved, Resolution.Unresolved {

    record Resolved(List<ResolvedFmodel> fmodels) implements Resolution {
        public Resolved {
            fmodels = List.copyOf(fmodels);
        }
    }

    /**
     * @param offending    the fmodel as submitted, parent marker included
     * @param parentAnchor the anchor it declared, or null when it declared none
     */
    record Unresolved(FmodelPatch offending, String parentAnchor) implements Resolution {}
}
