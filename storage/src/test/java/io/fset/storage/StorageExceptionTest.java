package io.fset.storage;

import org.junit.jupiter.api.Test;

import java.sql.BatchUpdateException;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class StorageExceptionTest {

    @Test
    void integrity_violations_become_conflicts() {
        StorageException e = StorageException.translate("upsert", new SQLException("dup", "23505"));
        assertInstanceOf(ConflictViolationException.class, e);
    }

    @Test
    void data_exceptions_become_invalid_values() {
        StorageException e = StorageException.translate("upsert", new SQLException("too long", "22001"));
        assertInstanceOf(InvalidValueException.class, e);
        assertTrue(e.getMessage().startsWith("upsert: "));
    }

    @Test
    void state_is_found_on_a_chained_batch_failure() {
        BatchUpdateException batch = new BatchUpdateException("batch failed", null, 0, new int[0]);
        batch.setNextException(new SQLException("too long", "22001"));

        assertInstanceOf(InvalidValueException.class, StorageException.translate("upsert", batch));
    }

    @Test
    void other_failures_stay_generic() {
        StorageException e = StorageException.translate("load project", new SQLException("gone", "08006"));

        assertEquals(StorageException.class, e.getClass());
        assertTrue(e.getMessage().contains("load project failed"));
    }
}
