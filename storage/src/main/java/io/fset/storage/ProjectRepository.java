// file: storage/src/main/java/io/fset/storage/ProjectRepository.java
package io.fset.storage;

import io.fset.core.model.NewProject;
import io.fset.core.model.Project;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Transactional storage for the project / file / fmodel tree.
 * <p>
 * Semantics:
 *  - Lookups return the project with its files and their fmodels loaded eagerly.
 *  - create() provisions a project outside of diff application.
 *  - inTransaction() runs a unit of work atomically: all of its writes commit
 *    together, or none of them become visible.
 */
public interface ProjectRepository {

    Optional<Project> findByKey(String key);

    Optional<Project> findByAnchor(String anchor);

    /**
     * Look a project up by a caller-supplied name: a UUID-shaped name is treated
     * as an anchor, anything else as a key.
     */
    Optional<Project> findByName(String name);

    /**
     * Insert a new project.
     *
     * @param project attributes; anchor and key must already be filled in
     * @param at      creation timestamp
     * @throws ConflictViolationException if the anchor or key is already taken
     */
    Project create(NewProject project, LocalDateTime at);

    /**
     * Run {@code work} inside one transaction.
     * <ul>
     *   <li>work returns normally: commit, {@link TransactionOutcome.Committed}.</li>
     *   <li>work called {@link Transaction#abort(Object)}: rollback, {@link TransactionOutcome.Aborted}.</li>
     *   <li>work throws: rollback, the exception propagates.</li>
     * </ul>
     */
    <T> TransactionOutcome<T> inTransaction(UnitOfWork<T> work);
}
