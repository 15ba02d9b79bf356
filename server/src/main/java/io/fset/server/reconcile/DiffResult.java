// file: server/src/main/java/io/fset/server/reconcile/DiffResult.java
package io.fset.server.reconcile;

import io.fset.core.diff.FmodelPatch;

/**
 * Caller-visible outcome of one diff application: committed, or rejected with
 * nothing persisted.
 */
public sealed interface DiffResult permits DiffResult.Committed, DiffResult.Rejected {

    enum Reason {
        /** An entry lacked its anchor or carried a value of the wrong type. */
        MALFORMED_ENTRY,
        /** An fmodel named a parent file that is not known to the project. */
        UNRESOLVED_PARENT,
        /** The store refused a write on a unique or foreign key. */
        CONFLICT_VIOLATION,
        /** The store could not hold a value as given, e.g. text longer than its column. */
        INVALID_VALUE,
        /** Any other store failure: connection loss, I/O, SQL errors. */
        STORE_FAILURE
    }

    /**
     * Rows touched per phase. Upsert counts are entries sent; delete counts are rows removed.
     */
    record Summary(
            boolean projectUpdated,
            int filesChanged,
            int fmodelsChanged,
            int fmodelsRemoved,
            int filesRemoved,
            int filesAdded,
            int fmodelsAdded
    ) {}

    record Committed(Summary summary) implements DiffResult {}

    /**
     * @param offending the fmodel that failed parent resolution; null for other reasons
     */
    record Rejected(Reason reason, String message, FmodelPatch offending) implements DiffResult {}
}
