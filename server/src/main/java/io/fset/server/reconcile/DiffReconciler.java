// file: server/src/main/java/io/fset/server/reconcile/DiffReconciler.java
package io.fset.server.reconcile;

import io.fset.core.ProjectDefaults;
import io.fset.core.diff.Diff;
import io.fset.core.diff.DiffPlan;
import io.fset.core.diff.DiffTranslator;
import io.fset.core.diff.FmodelPatch;
import io.fset.core.diff.MalformedEntryException;
import io.fset.core.model.FileRef;
import io.fset.core.model.Project;
import io.fset.core.reconcile.ParentResolver;
import io.fset.core.reconcile.Resolution;
import io.fset.core.reconcile.UpsertPolicy;
import io.fset.storage.ConflictViolationException;
import io.fset.storage.InvalidValueException;
import io.fset.storage.ProjectRepository;
import io.fset.storage.StorageException;
import io.fset.storage.Transaction;
import io.fset.storage.TransactionOutcome;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a client diff to a project as one transaction.
 * <p>
 * Steps:
 *  1) Translate every entry up front. A malformed entry rejects the diff before
 *     any write is attempted.
 *  2) Update phase ("changed"): patch the project row by id, upsert files by
 *     (key, project_id), resolve fmodel parents against the project's
 *     pre-existing files, upsert fmodels by anchor.
 *  3) Delete phase ("removed"): fmodels by anchor, then the project's files by anchor.
 *  4) Insert phase ("added"): upsert files by anchor and read back their ids,
 *     resolve fmodel parents against those files plus the pre-existing ones,
 *     upsert fmodels by anchor.
 * <p>
 * Step 4 computes the fmodel rows from the result of the file write, inside
 * the same transaction. An fmodel whose parent cannot be resolved aborts the
 * transaction; nothing from any phase survives.
 * <p>
 * Every store failure is reported as a rejection; nothing escapes as an exception.
 * <p>
 * Changed fmodels only ever resolve against files that existed before the diff,
 * even when the same diff adds their parent.
 */
public final class DiffReconciler {
    private static final Logger log = Logger.getLogger(DiffReconciler.class.getName());

    private final ProjectRepository repository;
    private final ProjectDefaults defaults;

    public DiffReconciler(ProjectRepository repository, ProjectDefaults defaults) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /**
     * Apply {@code diff} to {@code project}.
     *
     * @param project the target as loaded before the diff, with its files
     * @return Committed with per-phase counts, or Rejected with the reason
     */
    public DiffResult persist(Diff diff, Project project) {
        Objects.requireNonNull(diff, "diff");
        Objects.requireNonNull(project, "project");

        DiffPlan plan;
        try {
            plan = DiffTranslator.translate(diff);
        } catch (MalformedEntryException bad) {
            return reject(project, DiffResult.Reason.MALFORMED_ENTRY, bad.getMessage(), null);
        }

        LocalDateTime now = defaults.timestamp();
        TransactionOutcome<DiffResult.Summary> outcome;
        try {
            outcome = repository.inTransaction(tx -> apply(tx, plan, project, now));
        } catch (ConflictViolationException conflict) {
            return reject(project, DiffResult.Reason.CONFLICT_VIOLATION, conflict.getMessage(), null);
        } catch (InvalidValueException invalid) {
            return reject(project, DiffResult.Reason.INVALID_VALUE, invalid.getMessage(), null);
        } catch (StorageException failure) {
            log.log(Level.SEVERE, "store failure while applying diff to project " + project.key(), failure);
            return reject(project, DiffResult.Reason.STORE_FAILURE, failure.getMessage(), null);
        }

        if (outcome instanceof TransactionOutcome.Committed<DiffResult.Summary> committed) {
            DiffResult.Summary s = committed.value();
            log.log(Level.INFO, "diff committed for project {0}: {1}", new Object[]{project.key(), s});
            return new DiffResult.Committed(s);
        }

        Object reason = ((TransactionOutcome.Aborted<DiffResult.Summary>) outcome).reason();
        if (reason instanceof Resolution.Unresolved unresolved) {
            String msg = "fmodel " + unresolved.offending().anchor()
                    + " references unknown parent file " + unresolved.parentAnchor();
            return reject(project, DiffResult.Reason.UNRESOLVED_PARENT, msg, unresolved.offending());
        }
        throw new IllegalStateException("unexpected abort reason: " + reason);
    }

    private DiffResult.Summary apply(Transaction tx, DiffPlan plan, Project project, LocalDateTime now) {
        long projectId = project.id();
        List<FileRef> existing = project.fileRefs();

        // ---- update ----
        boolean projectUpdated = plan.changedProject()
                .map(p -> tx.updateProject(projectId, p, now) > 0)
                .orElse(false);

        tx.upsertFiles(projectId, plan.changedFiles(), UpsertPolicy.CHANGED_FILE, now, false);

        Resolution changed = ParentResolver.resolve(plan.changedFmodels(), existing);
        if (changed instanceof Resolution.Unresolved) {
            tx.abort(changed);
            return null;
        }
        int fmodelsChanged = tx.upsertFmodels(((Resolution.Resolved) changed).fmodels(), UpsertPolicy.CHANGED_FMODEL);

        // ---- delete: children before parents ----
        int fmodelsRemoved = tx.deleteFmodels(plan.removedFmodelAnchors());
        int filesRemoved = tx.deleteFiles(projectId, plan.removedFileAnchors());

        // ---- insert: fmodels depend on the ids the file write produced ----
        List<FileRef> inserted = tx.upsertFiles(projectId, plan.addedFiles(), UpsertPolicy.ADDED_FILE, now, true);

        List<FileRef> known = new ArrayList<>(inserted.size() + existing.size());
        known.addAll(inserted);
        known.addAll(existing);

        Resolution added = ParentResolver.resolve(plan.addedFmodels(), known);
        if (added instanceof Resolution.Unresolved) {
            tx.abort(added);
            return null;
        }
        int fmodelsAdded = tx.upsertFmodels(((Resolution.Resolved) added).fmodels(), UpsertPolicy.ADDED_FMODEL);

        return new DiffResult.Summary(
                projectUpdated,
                plan.changedFiles().size(),
                fmodelsChanged,
                fmodelsRemoved,
                filesRemoved,
                plan.addedFiles().size(),
                fmodelsAdded
        );
    }

    private static DiffResult reject(Project project, DiffResult.Reason reason, String message,
                                     FmodelPatch offending) {
        log.log(Level.WARNING, "diff rejected for project {0}: {1} ({2})",
                new Object[]{project.key(), reason, message});
        return new DiffResult.Rejected(reason, message, offending);
    }
}
