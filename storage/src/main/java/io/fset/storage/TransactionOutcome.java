package io.fset.storage;

/**
 * Result of {@link ProjectRepository#inTransaction(UnitOfWork)}:
 *  - Committed: every staged write is durable.
 *  - Aborted: the unit of work asked for a rollback; {@code reason} is what it passed to abort().
 */
public sealed interface TransactionOutcome<T> permits TransactionOutcome.Committed, TransactionOutcome.Aborted {

    record Committed<T>(T value) implements TransactionOutcome<T> {}

    record Aborted<T>(Object reason) implements TransactionOutcome<T> {}
}
