package io.fset.storage;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Unchecked wrapper for failures of the backing store.
 */
public class StorageException extends RuntimeException {
    private static final String INTEGRITY_VIOLATION = "23";
    private static final String DATA_EXCEPTION = "22";

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wrap a JDBC failure. Integrity constraint violations (SQLState class 23)
     * become {@link ConflictViolationException}, data exceptions (class 22)
     * become {@link InvalidValueException}.
     */
    public static StorageException translate(String operation, SQLException e) {
        if (hasState(e, INTEGRITY_VIOLATION)) {
            return new ConflictViolationException(operation + ": " + e.getMessage(), e);
        }
        if (hasState(e, DATA_EXCEPTION)) {
            return new InvalidValueException(operation + ": " + e.getMessage(), e);
        }
        return new StorageException(operation + " failed: " + e.getMessage(), e);
    }

    /** True if {@code e}, a chained exception or a cause carries an SQLState of the given class. */
    private static boolean hasState(SQLException e, String stateClass) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (INTEGRITY_VIOLATION.equals(stateClass) && cur instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            String state = cur.getSQLState();
            if (state != null && state.startsWith(stateClass)) {
                return true;
            }
            if (cur.getCause() instanceof SQLException cause && cause != cur.getNextException()) {
                if (hasState(cause, stateClass)) {
                    return true;
                }
            }
        }
        return false;
    }
}
