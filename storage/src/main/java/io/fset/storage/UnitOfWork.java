package io.fset.storage;

/** Body of a transaction. */
@FunctionalInterface
public interface UnitOfWork<T> {
    T run(Transaction tx);
}
