package io.fset.core.diff;

import java.util.Objects;
import java.util.Optional;

/**
 * Attribute patch for the project row. Empty optionals leave the stored value untouched.
 * The anchor identifies the entry; it is never written back.
 */
public record ProjectPatch(
        String anchor,
        Optional<String> key,
        Optional<Integer> order,
        Optional<String> description
) {
    public ProjectPatch {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(description, "description");
    }

    public boolean isEmpty() {
        return key.isEmpty() && order.isEmpty() && description.isEmpty();
    }
}
