package io.fset.storage;

/**
 * A unique-key or foreign-key violation the upsert policy did not absorb.
 * The enclosing transaction has been rolled back.
 */
public class ConflictViolationException extends StorageException {

    public ConflictViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
