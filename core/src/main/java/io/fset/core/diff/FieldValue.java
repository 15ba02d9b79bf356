// file: core/src/main/java/io/fset/core/diff/FieldValue.java
package io.fset.core.diff;

import java.util.Map;

/**
 * Raw value of one field in a diff entry.
 * <p>
 * Clients send changed scalars either plainly or wrapped as
 * {@code {"old": v0, "new": v1}}. Both shapes are normalized here, once, so the
 * translator only ever asks for {@link #current()}.
 */
public sealed interface FieldValue permits FieldValue.Scalar, FieldValue.OldNew {

    /** The value the entity should end up with. */
    Object current();

    record Scalar(Object value) implements FieldValue {
        @Override
        public Object current() {
            return value;
        }
    }

    record OldNew(Object oldValue, Object newValue) implements FieldValue {
        @Override
        public Object current() {
            return newValue;
        }
    }

    /**
     * Classify a raw value. Any mapping carrying a {@code "new"} key is an
     * old/new pair; everything else is a scalar.
     */
    static FieldValue of(Object raw) {
        if (raw instanceof Map<?, ?> m && m.containsKey("new")) {
            return new OldNew(m.get("old"), m.get("new"));
        }
        return new Scalar(raw);
    }
}
