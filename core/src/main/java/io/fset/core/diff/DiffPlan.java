// file: core/src/main/java/io/fset/core/diff/DiffPlan.java
package io.fset.core.diff;

import java.util.List;
import java.util.Optional;

/**
 * Fully translated diff, grouped by the phase that consumes it.
 * <p>
 * Phase order is update, delete, insert. Fmodels nested under a file entry
 * have already been flattened into the fmodel list of the same bucket.
 */
public record DiffPlan(
        Optional<ProjectPatch> changedProject,
        List<FilePatch> changedFiles,
        List<FmodelPatch> changedFmodels,
        List<String> removedFileAnchors,
        List<String> removedFmodelAnchors,
        List<FilePatch> addedFiles,
        List<FmodelPatch> addedFmodels
) {
    public DiffPlan {
        changedFiles = List.copyOf(changedFiles);
        changedFmodels = List.copyOf(changedFmodels);
        removedFileAnchors = List.copyOf(removedFileAnchors);
        removedFmodelAnchors = List.copyOf(removedFmodelAnchors);
        addedFiles = List.copyOf(addedFiles);
        addedFmodels = List.copyOf(addedFmodels);
    }

    public boolean isEmpty() {
        return changedProject.map(ProjectPatch::isEmpty).orElse(true)
                && changedFiles.isEmpty()
                && changedFmodels.isEmpty()
                && removedFileAnchors.isEmpty()
                && removedFmodelAnchors.isEmpty()
                && addedFiles.isEmpty()
                && addedFmodels.isEmpty();
    }
}
