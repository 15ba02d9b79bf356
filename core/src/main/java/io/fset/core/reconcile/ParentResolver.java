// file: core/src/main/java/io/fset/core/reconcile/ParentResolver.java
package io.fset.core.reconcile;

import io.fset.core.diff.FmodelPatch;
import io.fset.core.model.FileRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Referential integrity guard for fmodel writes.
 * <p>
 * For each fmodel:
 *  1) pop the "parentAnchor" marker out of its payload,
 *  2) find the known file with that anchor,
 *  3) attach the file's id.
 * <p>
 * A single fmodel without a known parent makes the whole batch {@link Resolution.Unresolved};
 * fmodels are never dropped one by one.
 * <p>
 * When several known files share an anchor, the first in {@code knownFiles} wins,
 * so callers list freshly written files ahead of the preloaded ones.
 */
public final class ParentResolver {

    private ParentResolver() {
        // utility
    }

    public static Resolution resolve(List<FmodelPatch> fmodels, List<FileRef> knownFiles) {
        Map<String, Long> idsByAnchor = new HashMap<>();
        for (FileRef f : knownFiles) {
            idsByAnchor.putIfAbsent(f.anchor(), f.id());
        }

        List<ResolvedFmodel> resolved = new ArrayList<>(fmodels.size());
        for (FmodelPatch m : fmodels) {
            String parent = m.parentAnchor().orElse(null);
            Long fileId = parent == null ? null : idsByAnchor.get(parent);
            if (fileId == null) {
                return new Resolution.Unresolved(m, parent);
            }
            resolved.add(new ResolvedFmodel(m.withoutParentAnchor(), fileId));
        }
        return new Resolution.Resolved(resolved);
    }
}
