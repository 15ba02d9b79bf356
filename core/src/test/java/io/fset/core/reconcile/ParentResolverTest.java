// file: core/src/test/java/io/fset/core/reconcile/ParentResolverTest.java
package io.fset.core.reconcile;

import io.fset.core.diff.DiffTranslator;
import io.fset.core.diff.FmodelPatch;
import io.fset.core.model.FileRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for the referential integrity guard.
 *
 * Focus:
 *  - Resolved fmodels carry their parent's id and no longer carry the marker.
 *  - One unknown parent fails the whole batch.
 *  - Earlier entries in the known-file list win on duplicate anchors.
 */
class ParentResolverTest {

    private static FmodelPatch fmodel(String anchor, String parent) {
        return DiffTranslator.toFmodelPatch(Map.of("$anchor", anchor, "parentAnchor", parent, "min", 1));
    }

    @Test
    void resolves_parent_and_strips_marker() {
        Resolution r = ParentResolver.resolve(
                List.of(fmodel("a-m1", "a-f1")),
                List.of(new FileRef(7L, "a-f1"))
        );

        assertInstanceOf(Resolution.Resolved.class, r);
        ResolvedFmodel m = ((Resolution.Resolved) r).fmodels().get(0);
        assertEquals(7L, m.fileId());
        assertEquals(Map.of("min", 1), m.patch().sch());
        assertFalse(m.patch().sch().containsKey(FmodelPatch.PARENT_ANCHOR));
    }

    @Test
    void unknown_parent_fails_the_whole_batch() {
        FmodelPatch good = fmodel("a-m1", "a-f1");
        FmodelPatch bad = fmodel("a-m2", "a-missing");

        Resolution r = ParentResolver.resolve(List.of(good, bad), List.of(new FileRef(7L, "a-f1")));

        Resolution.Unresolved u = assertInstanceOf(Resolution.Unresolved.class, r);
        assertEquals("a-m2", u.offending().anchor());
        assertEquals("a-missing", u.parentAnchor());
        // the offending record is reported as submitted
        assertTrue(u.offending().sch().containsKey(FmodelPatch.PARENT_ANCHOR));
    }

    @Test
    void fmodel_without_parent_marker_is_unresolved() {
        FmodelPatch orphan = DiffTranslator.toFmodelPatch(Map.of("$anchor", "a-m1"));

        Resolution r = ParentResolver.resolve(List.of(orphan), List.of(new FileRef(7L, "a-f1")));

        Resolution.Unresolved u = assertInstanceOf(Resolution.Unresolved.class, r);
        assertNull(u.parentAnchor());
    }

    @Test
    void first_known_file_wins_on_duplicate_anchor() {
        Resolution r = ParentResolver.resolve(
                List.of(fmodel("a-m1", "a-f1")),
                List.of(new FileRef(11L, "a-f1"), new FileRef(3L, "a-f1"))
        );

        assertEquals(11L, ((Resolution.Resolved) r).fmodels().get(0).fileId());
    }

    @Test
    void empty_batch_resolves_trivially() {
        Resolution r = ParentResolver.resolve(List.of(), List.of());
        assertEquals(List.of(), ((Resolution.Resolved) r).fmodels());
    }
}
