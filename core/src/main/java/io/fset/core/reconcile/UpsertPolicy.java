// file: core/src/main/java/io/fset/core/reconcile/UpsertPolicy.java
package io.fset.core.reconcile;

import java.util.List;

/**
 * Conflict handling for every batch upsert the reconciler stages.
 * <p>
 * <pre>
 *   entity  phase    conflict target        replaced on conflict
 *   file    changed  (key, project_id)      key, order
 *   fmodel  changed  anchor                 key, type, is_entry, sch
 *   file    added    anchor                 key, order
 *   fmodel  added    anchor                 key, type, is_entry, sch
 * </pre>
 * Changed files are matched by key because the client may not know their anchor
 * yet; added files come with an anchor the client minted.
 * The project row is not upserted: it is updated by id with the patched attributes only.
 * <p>
 * Attribute names are logical; the storage layer maps them to columns.
 */
public enum UpsertPolicy {

    CHANGED_FILE(Entity.FILE, List.of("key", "project_id"), List.of("key", "order")),
    CHANGED_FMODEL(Entity.FMODEL, List.of("anchor"), List.of("key", "type", "is_entry", "sch")),
    ADDED_FILE(Entity.FILE, List.of("anchor"), List.of("key", "order")),
    ADDED_FMODEL(Entity.FMODEL, List.of("anchor"), List.of("key", "type", "is_entry", "sch"));

    public enum Entity { FILE, FMODEL }

    private final Entity entity;
    private final List<String> conflictTarget;
    private final List<String> replaceOnConflict;

    UpsertPolicy(Entity entity, List<String> conflictTarget, List<String> replaceOnConflict) {
        this.entity = entity;
        this.conflictTarget = conflictTarget;
        this.replaceOnConflict = replaceOnConflict;
    }

    public Entity entity() {
        return entity;
    }

    public List<String> conflictTarget() {
        return conflictTarget;
    }

    public List<String> replaceOnConflict() {
        return replaceOnConflict;
    }
}
