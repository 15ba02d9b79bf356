// file: core/src/test/java/io/fset/core/diff/DiffPlanTest.java
package io.fset.core.diff;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for translating a whole diff into a per-phase plan.
 */
class DiffPlanTest {

    @Test
    void absent_buckets_translate_to_an_empty_plan() {
        DiffPlan plan = DiffTranslator.translate(Diff.of(Map.of()));

        assertTrue(plan.isEmpty());
        assertEquals(Optional.empty(), plan.changedProject());
    }

    @Test
    void buckets_are_split_by_phase() {
        Map<String, Object> raw = Map.of(
                "changed", Map.of(
                        "project", Map.of("$anchor", "a-p", "key", "renamed"),
                        "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "users"))
                ),
                "removed", Map.of(
                        "files", Map.of("2", Map.of("$anchor", "a-f2")),
                        "fmodels", Map.of("3", Map.of("$anchor", "a-m3"))
                ),
                "added", Map.of(
                        "fmodels", Map.of("4", Map.of("$anchor", "a-m4", "parentAnchor", "a-f1"))
                )
        );

        DiffPlan plan = DiffTranslator.translate(Diff.of(raw));

        assertEquals(Optional.of("renamed"), plan.changedProject().orElseThrow().key());
        assertEquals(1, plan.changedFiles().size());
        assertEquals(List.of("a-f2"), plan.removedFileAnchors());
        assertEquals(List.of("a-m3"), plan.removedFmodelAnchors());
        assertEquals("a-m4", plan.addedFmodels().get(0).anchor());
        assertTrue(plan.addedFiles().isEmpty());
        assertFalse(plan.isEmpty());
    }

    @Test
    void null_project_entry_is_no_patch() {
        Map<String, Object> changed = new LinkedHashMap<>();
        changed.put("project", null);

        DiffPlan plan = DiffTranslator.translate(Diff.of(Map.of("changed", changed)));
        assertEquals(Optional.empty(), plan.changedProject());
    }

    @Test
    void nested_file_fields_default_their_parent_to_the_file() {
        Map<String, Object> raw = Map.of(
                "added", Map.of(
                        "files", Map.of("1", Map.of(
                                "$anchor", "a-f1",
                                "fields", List.of(
                                        Map.of("$anchor", "a-m1"),
                                        Map.of("$anchor", "a-m2", "parentAnchor", "a-other")
                                )
                        )),
                        "fmodels", Map.of("9", Map.of("$anchor", "a-m9", "parentAnchor", "a-f1"))
                )
        );

        DiffPlan plan = DiffTranslator.translate(Diff.of(raw));

        List<FmodelPatch> fmodels = plan.addedFmodels();
        assertEquals(3, fmodels.size());
        assertEquals(Optional.of("a-f1"), fmodels.get(0).parentAnchor());
        assertEquals(Optional.of("a-other"), fmodels.get(1).parentAnchor());
        assertEquals("a-m9", fmodels.get(2).anchor());
    }

    @Test
    void non_object_bucket_is_malformed() {
        assertThrows(MalformedEntryException.class,
                () -> DiffTranslator.translate(Diff.of(Map.of("added", List.of()))));
        assertThrows(MalformedEntryException.class,
                () -> DiffTranslator.translate(Diff.of(Map.of("removed", Map.of("files", "a-f1")))));
    }

    @Test
    void removed_entry_without_anchor_is_malformed() {
        Map<String, Object> raw = Map.of("removed", Map.of("fmodels", Map.of("1", Map.of("key", "x"))));

        assertThrows(MalformedEntryException.class, () -> DiffTranslator.translate(Diff.of(raw)));
    }
}
