// file: storage/src/main/java/io/fset/storage/Transaction.java
package io.fset.storage;

import io.fset.core.diff.FilePatch;
import io.fset.core.diff.ProjectPatch;
import io.fset.core.model.FileRef;
import io.fset.core.reconcile.ResolvedFmodel;
import io.fset.core.reconcile.UpsertPolicy;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Write operations available inside {@link ProjectRepository#inTransaction(UnitOfWork)}.
 * <p>
 * Each operation executes immediately on the transaction's connection, so later
 * operations see the effects (and generated ids) of earlier ones. Batch
 * operations are sent as one set-oriented statement batch, not row by row.
 * All methods throw {@link StorageException} on failure and
 * {@link IllegalStateException} once the transaction has been aborted.
 */
public interface Transaction {

    /**
     * Update the project row by id with the attributes present in {@code patch}.
     * An empty patch writes nothing.
     *
     * @return rows updated (0 or 1)
     */
    int updateProject(long projectId, ProjectPatch patch, LocalDateTime at);

    /**
     * Batch upsert of files owned by {@code projectId}.
     * Conflict target and replaced columns come from {@code policy}; attributes absent
     * from a patch keep their stored value on conflict and take the column default on insert.
     *
     * @param at        inserted_at / updated_at of newly inserted rows
     * @param returning when true, return id and anchor of every inserted or updated row
     * @return the written rows in input order, or an empty list when not requested
     */
    List<FileRef> upsertFiles(long projectId, List<FilePatch> files, UpsertPolicy policy,
                              LocalDateTime at, boolean returning);

    /**
     * Batch upsert of fmodels whose parent file is already resolved.
     *
     * @return number of patches sent
     */
    int upsertFmodels(List<ResolvedFmodel> fmodels, UpsertPolicy policy);

    /** Delete the project's files whose anchor is in {@code anchors}. */
    int deleteFiles(long projectId, Collection<String> anchors);

    /** Delete fmodels by anchor. Not scoped to a project: fmodel anchors are globally unique. */
    int deleteFmodels(Collection<String> anchors);

    /**
     * Mark the transaction for rollback. The unit of work should return right after;
     * the repository then rolls back and reports {@code reason}.
     */
    void abort(Object reason);

    boolean isAborted();
}
