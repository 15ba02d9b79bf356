package io.fset.storage;

/**
 * A value the store cannot hold as given, such as text longer than its column.
 * The enclosing transaction has been rolled back.
 */
public class InvalidValueException extends StorageException {

    public InvalidValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
