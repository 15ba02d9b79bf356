// file: core/src/main/java/io/fset/core/diff/FmodelPatch.java
package io.fset.core.diff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translated fmodel entry.
 * <p>
 * {@code sch} carries every field of the entry that is not one of the recognized
 * columns, verbatim. While the patch travels through reconciliation it may
 * still hold the {@value #PARENT_ANCHOR} marker; that marker is wire metadata
 * and is removed before the record is stored.
 */
public record FmodelPatch(
        String anchor,
        Optional<String> type,
        Optional<String> key,
        Optional<Boolean> isEntry,
        Map<String, Object> sch
) {
    public static final String PARENT_ANCHOR = "parentAnchor";

    public FmodelPatch {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(isEntry, "isEntry");
        sch = sch == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sch));
    }

    /** Parent file anchor declared by the client, if any. */
    public Optional<String> parentAnchor() {
        Object v = sch.get(PARENT_ANCHOR);
        return v == null ? Optional.empty() : Optional.of(v.toString());
    }

    /** Same patch with the parent marker popped out of {@code sch}. */
    public FmodelPatch withoutParentAnchor() {
        if (!sch.containsKey(PARENT_ANCHOR)) {
            return this;
        }
        Map<String, Object> stripped = new LinkedHashMap<>(sch);
        stripped.remove(PARENT_ANCHOR);
        return new FmodelPatch(anchor, type, key, isEntry, stripped);
    }

    /** Same patch with a parent marker set, unless the client already declared one. */
    public FmodelPatch withDefaultParentAnchor(String parentAnchor) {
        if (sch.get(PARENT_ANCHOR) != null) {
            return this;
        }
        Map<String, Object> withParent = new LinkedHashMap<>(sch);
        withParent.put(PARENT_ANCHOR, parentAnchor);
        return new FmodelPatch(anchor, type, key, isEntry, withParent);
    }
}
