// file: core/src/main/java/io/fset/core/diff/DiffEntry.java
package io.fset.core.diff;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One loosely-typed diff record with two accessors:
 *  - {@link #required(String)}: the field must be present, otherwise the entry is malformed.
 *  - {@link #optional(String)}: present-or-absent. A JSON null counts as absent.
 * <p>
 * Either accessor unwraps {"old","new"} pairs into a {@link FieldValue}. An
 * old/new pair whose "new" side is null is reported as absent.
 */
public final class DiffEntry {

    private final String kind;
    private final Map<String, Object> raw;

    private DiffEntry(String kind, Map<String, Object> raw) {
        this.kind = kind;
        this.raw = raw;
    }

    /**
     * Wrap a raw entry.
     *
     * @param kind entity kind, used in error messages ("project", "file", "fmodel")
     * @param raw  must be a mapping with string keys
     */
    public static DiffEntry of(String kind, Object raw) {
        if (!(raw instanceof Map<?, ?> m)) {
            throw new MalformedEntryException(kind + " entry must be an object");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : m.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new MalformedEntryException(kind + " entry has a non-string field name: " + entry.getKey());
            }
            fields.put(name, entry.getValue());
        }
        return new DiffEntry(kind, fields);
    }

    public String kind() {
        return kind;
    }

    public FieldValue required(String field) {
        return optional(field).orElseThrow(() -> new MalformedEntryException(
                kind + " entry is missing required field '" + field + "'"));
    }

    public Optional<FieldValue> optional(String field) {
        Object value = raw.get(field);
        if (value == null) {
            return Optional.empty();
        }
        FieldValue fv = FieldValue.of(value);
        return fv.current() == null ? Optional.empty() : Optional.of(fv);
    }

    /** Verbatim copy of every field except the given ones, in entry order. */
    public Map<String, Object> without(Collection<String> fields) {
        Map<String, Object> out = new LinkedHashMap<>(raw);
        for (String f : fields) {
            out.remove(f);
        }
        return out;
    }
}
