// file: core/src/main/java/io/fset/core/diff/DiffTranslator.java
package io.fset.core.diff;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts loosely-typed diff entries into typed patches. Pure, no I/O.
 * <p>
 * Rules:
 *  - "$anchor" is the only required field; without it the entry is malformed.
 *  - Every other recognized field is optional. Absent fields stay absent in the
 *    patch (untouched on update, defaulted on insert), never null.
 *  - {"old": .., "new": ..} wrappers contribute their "new" side only.
 *  - Fmodel fields outside {"$anchor", "type", "key", "is_entry"} go verbatim into "sch".
 *  - A file's "fields" is a collection of fmodel entries, translated recursively.
 */
public final class DiffTranslator {

    public static final String ANCHOR = "$anchor";

    private static final Set<String> FMODEL_COLUMNS = Set.of(ANCHOR, "type", "key", "is_entry");

    private DiffTranslator() {
        // utility
    }

    /**
     * Translate every entry of a diff.
     *
     * @throws MalformedEntryException on the first entry that cannot be translated
     */
    public static DiffPlan translate(Diff diff) {
        Optional<ProjectPatch> project = diff.changedProject().map(DiffTranslator::toProjectPatch);

        List<FilePatch> changedFiles = toFilePatches(diff.entries(Diff.CHANGED, Diff.FILES));
        List<FmodelPatch> changedFmodels = withNested(changedFiles,
                toFmodelPatches(diff.entries(Diff.CHANGED, Diff.FMODELS)));

        List<String> removedFiles = new ArrayList<>();
        for (Object e : diff.entries(Diff.REMOVED, Diff.FILES)) {
            removedFiles.add(toFilePatch(e).anchor());
        }
        List<String> removedFmodels = new ArrayList<>();
        for (Object e : diff.entries(Diff.REMOVED, Diff.FMODELS)) {
            removedFmodels.add(toFmodelPatch(e).anchor());
        }

        List<FilePatch> addedFiles = toFilePatches(diff.entries(Diff.ADDED, Diff.FILES));
        List<FmodelPatch> addedFmodels = withNested(addedFiles,
                toFmodelPatches(diff.entries(Diff.ADDED, Diff.FMODELS)));

        return new DiffPlan(
                project,
                changedFiles,
                changedFmodels,
                removedFiles,
                removedFmodels,
                addedFiles,
                addedFmodels
        );
    }

    public static ProjectPatch toProjectPatch(Object raw) {
        DiffEntry e = DiffEntry.of("project", raw);
        return new ProjectPatch(
                asString(e, ANCHOR, e.required(ANCHOR)),
                e.optional("key").map(v -> asString(e, "key", v)),
                e.optional("order").map(v -> asInteger(e, "order", v)),
                e.optional("description").map(v -> asString(e, "description", v))
        );
    }

    public static FilePatch toFilePatch(Object raw) {
        DiffEntry e = DiffEntry.of("file", raw);
        return new FilePatch(
                asString(e, ANCHOR, e.required(ANCHOR)),
                e.optional("key").map(v -> asString(e, "key", v)),
                e.optional("order").map(v -> asInteger(e, "order", v)),
                e.optional("fields").map(v -> toNestedFmodels(e, v)).orElse(List.of())
        );
    }

    public static FmodelPatch toFmodelPatch(Object raw) {
        DiffEntry e = DiffEntry.of("fmodel", raw);
        return new FmodelPatch(
                asString(e, ANCHOR, e.required(ANCHOR)),
                e.optional("type").map(v -> asString(e, "type", v)),
                e.optional("key").map(v -> asString(e, "key", v)),
                e.optional("is_entry").map(v -> asBoolean(e, "is_entry", v)),
                e.without(FMODEL_COLUMNS)
        );
    }

    // ---------- helpers ----------

    private static List<FilePatch> toFilePatches(List<Object> entries) {
        List<FilePatch> out = new ArrayList<>(entries.size());
        for (Object e : entries) {
            out.add(toFilePatch(e));
        }
        return out;
    }

    private static List<FmodelPatch> toFmodelPatches(Collection<?> entries) {
        List<FmodelPatch> out = new ArrayList<>(entries.size());
        for (Object e : entries) {
            out.add(toFmodelPatch(e));
        }
        return out;
    }

    /** Nested fmodels first, each defaulting its parent to the file it was nested in. */
    private static List<FmodelPatch> withNested(List<FilePatch> files, List<FmodelPatch> flat) {
        List<FmodelPatch> out = new ArrayList<>(flat.size());
        for (FilePatch f : files) {
            for (FmodelPatch m : f.fmodels()) {
                out.add(m.withDefaultParentAnchor(f.anchor()));
            }
        }
        out.addAll(flat);
        return out;
    }

    private static List<FmodelPatch> toNestedFmodels(DiffEntry owner, FieldValue fields) {
        Object v = fields.current();
        if (v instanceof Map<?, ?> byId) {
            return toFmodelPatches(byId.values());
        }
        if (v instanceof Collection<?> list) {
            return toFmodelPatches(list);
        }
        throw new MalformedEntryException(owner.kind() + " field 'fields' must be an object or array");
    }

    private static String asString(DiffEntry e, String field, FieldValue value) {
        Object v = value.current();
        if (v instanceof String s) {
            return s;
        }
        if (v instanceof Number n) {
            return n.toString();
        }
        throw new MalformedEntryException(e.kind() + " field '" + field + "' must be a string");
    }

    private static Integer asInteger(DiffEntry e, String field, FieldValue value) {
        Object v = value.current();
        if (v instanceof Integer || v instanceof Long || v instanceof Short) {
            try {
                return Math.toIntExact(((Number) v).longValue());
            } catch (ArithmeticException overflow) {
                throw new MalformedEntryException(e.kind() + " field '" + field + "' is out of integer range: " + v);
            }
        }
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException nfe) {
                throw new MalformedEntryException(e.kind() + " field '" + field + "' must be an integer");
            }
        }
        throw new MalformedEntryException(e.kind() + " field '" + field + "' must be an integer");
    }

    private static Boolean asBoolean(DiffEntry e, String field, FieldValue value) {
        Object v = value.current();
        if (v instanceof Boolean b) {
            return b;
        }
        throw new MalformedEntryException(e.kind() + " field '" + field + "' must be a boolean");
    }
}
