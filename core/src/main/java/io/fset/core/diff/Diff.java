// file: core/src/main/java/io/fset/core/diff/Diff.java
package io.fset.core.diff;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured diff as submitted by a client:
 * <pre>
 *   {
 *     "changed": { "project": entry|null, "files": {id: entry}, "fmodels": {id: entry} },
 *     "removed": { "files": {id: entry}, "fmodels": {id: entry} },
 *     "added":   { "files": {id: entry}, "fmodels": {id: entry} }
 *   }
 * </pre>
 * Buckets and kinds may be missing; a missing one contributes no entries.
 * The ids keying each kind are client-side only and ignored.
 */
public final class Diff {

    public static final String CHANGED = "changed";
    public static final String REMOVED = "removed";
    public static final String ADDED = "added";

    public static final String PROJECT = "project";
    public static final String FILES = "files";
    public static final String FMODELS = "fmodels";

    private final Map<String, Object> raw;

    private Diff(Map<String, Object> raw) {
        this.raw = raw;
    }

    public static Diff of(Map<String, Object> raw) {
        return new Diff(Objects.requireNonNull(raw, "raw"));
    }

    public boolean hasBucket(String bucket) {
        return raw.get(bucket) != null;
    }

    /** The changed project entry, if the diff carries one. */
    public Optional<Object> changedProject() {
        return Optional.ofNullable(bucket(CHANGED).get(PROJECT));
    }

    /**
     * Entries of one entity kind inside one bucket, in submission order.
     *
     * @throws MalformedEntryException if the bucket or kind is not an object
     */
    public List<Object> entries(String bucket, String kind) {
        Object group = bucket(bucket).get(kind);
        if (group == null) {
            return List.of();
        }
        if (!(group instanceof Map<?, ?> byId)) {
            throw new MalformedEntryException("'" + bucket + "." + kind + "' must be an object");
        }
        Collection<?> values = byId.values();
        return new ArrayList<>(values);
    }

    private Map<?, ?> bucket(String name) {
        Object b = raw.get(name);
        if (b == null) {
            return Map.of();
        }
        if (!(b instanceof Map<?, ?> m)) {
            throw new MalformedEntryException("'" + name + "' must be an object");
        }
        return m;
    }
}
