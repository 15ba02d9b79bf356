// file: server/src/test/java/io/fset/server/reconcile/DiffReconcilerTest.java
package io.fset.server.reconcile;

import io.fset.core.ProjectDefaults;
import io.fset.core.WireFormat;
import io.fset.core.diff.Diff;
import io.fset.core.model.Fmodel;
import io.fset.core.model.NewProject;
import io.fset.core.model.Project;
import io.fset.core.model.ProjectFile;
import io.fset.storage.JdbcProjectRepository;
import io.fset.storage.ProjectRepository;
import io.fset.storage.StorageException;
import io.fset.storage.TransactionOutcome;
import io.fset.storage.UnitOfWork;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for applying diffs against a real (in-memory) store.
 *
 * Focus:
 *  - All-or-nothing: an unresolved parent leaves files and fmodels untouched.
 *  - Upserts are idempotent per anchor and take the latest values.
 *  - Fmodels added next to their parent file get the new file's id.
 *  - Old/new wrappers, sch passthrough, parentAnchor stripping.
 *  - Every failure, including store errors, comes back as a Rejected result.
 */
class DiffReconcilerTest {

    private JdbcProjectRepository repo;
    private DiffReconciler reconciler;
    private Project project;

    @BeforeEach
    void setUp() {
        String url = "jdbc:h2:mem:reconcile-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        repo = JdbcProjectRepository.open(url, "sa", "", 4);
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
        ProjectDefaults defaults = new ProjectDefaults(clock, () -> UUID.randomUUID().toString());
        reconciler = new DiffReconciler(repo, defaults);
        project = repo.create(new NewProject("7c9e6679-7425-40de-944b-e07fc1f90ae7", "P", 0, null),
                defaults.timestamp());
    }

    @AfterEach
    void tearDown() {
        repo.close();
    }

    // ---------- helpers ----------

    private DiffResult apply(Map<String, Object> diff) {
        return reconciler.persist(Diff.of(diff), reload());
    }

    private Project reload() {
        return repo.findByKey("P").orElseThrow();
    }

    private DiffResult.Summary committed(DiffResult r) {
        return assertInstanceOf(DiffResult.Committed.class, r, () -> "expected commit, got " + r).summary();
    }

    private DiffResult.Rejected rejected(DiffResult r) {
        return assertInstanceOf(DiffResult.Rejected.class, r, () -> "expected rejection, got " + r);
    }

    private ProjectFile file(String anchor) {
        return reload().files().stream()
                .filter(f -> f.anchor().equals(anchor))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no file " + anchor));
    }

    private Fmodel fmodel(String anchor) {
        return reload().files().stream()
                .flatMap(f -> f.fmodels().stream())
                .filter(m -> m.anchor().equals(anchor))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no fmodel " + anchor));
    }

    private long fmodelCount() {
        return reload().files().stream().mapToLong(f -> f.fmodels().size()).sum();
    }

    /** Project P with file a-f1 ("users", order 1). */
    private long seedFile() {
        committed(apply(Map.of("added", Map.of("files",
                Map.of("1", Map.of("$anchor", "a-f1", "key", "users", "order", 1))))));
        return file("a-f1").id();
    }

    // ---------- end-to-end ----------

    @Test
    void added_fmodel_attaches_to_existing_file_and_drops_parent_anchor() {
        long f1 = seedFile();

        DiffResult r = apply(Map.of("added", Map.of("fmodels", Map.of("1", Map.of(
                "$anchor", "a-m1", "type", "object", "key", "root", "is_entry", true, "parentAnchor", "a-f1")))));

        assertEquals(1, committed(r).fmodelsAdded());
        Fmodel m = fmodel("a-m1");
        assertEquals(f1, m.fileId());
        assertEquals("object", m.type());
        assertEquals("root", m.key());
        assertTrue(m.isEntry());
        assertFalse(m.sch().containsKey("parentAnchor"));
        assertTrue(m.sch().isEmpty());
    }

    @Test
    void added_fmodel_with_missing_parent_is_rejected_and_writes_nothing() {
        seedFile();

        DiffResult r = apply(Map.of("added", Map.of("fmodels", Map.of("1", Map.of(
                "$anchor", "a-m1", "type", "object", "key", "root", "is_entry", true, "parentAnchor", "a-missing")))));

        DiffResult.Rejected rej = rejected(r);
        assertEquals(DiffResult.Reason.UNRESOLVED_PARENT, rej.reason());
        assertEquals("a-m1", rej.offending().anchor());
        assertTrue(rej.message().contains("a-missing"));
        assertEquals(0, fmodelCount());
    }

    // ---------- atomicity ----------

    @Test
    void unresolved_parent_rolls_back_every_phase() {
        long f1 = seedFile();
        committed(apply(Map.of("added", Map.of("fmodels", Map.of("1",
                Map.of("$anchor", "a-m0", "parentAnchor", "a-f1", "min", 1))))));
        Map<String, Object> before = WireFormat.toWire(reload());

        DiffResult r = apply(Map.of(
                "changed", Map.of(
                        "project", Map.of("$anchor", project.anchor(), "order", 9),
                        "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "users", "order", 5)),
                        "fmodels", Map.of("1", Map.of("$anchor", "a-m0", "parentAnchor", "a-f1", "min", 2))),
                "removed", Map.of("fmodels", Map.of("1", Map.of("$anchor", "a-m0"))),
                "added", Map.of(
                        "files", Map.of("1", Map.of("$anchor", "a-f2", "key", "orders", "order", 2)),
                        "fmodels", Map.of(
                                "1", Map.of("$anchor", "a-m1", "parentAnchor", "a-f2"),
                                "2", Map.of("$anchor", "a-m2", "parentAnchor", "a-missing")))));

        assertEquals(DiffResult.Reason.UNRESOLVED_PARENT, rejected(r).reason());
        Project after = reload();
        assertEquals(before, WireFormat.toWire(after));
        assertEquals(0, after.order());
        assertEquals(1, after.files().size());
        assertEquals(f1, fmodel("a-m0").fileId());
        assertEquals(Map.of("min", 1), fmodel("a-m0").sch());
    }

    // ---------- idempotence ----------

    @Test
    void reapplying_an_added_diff_keeps_one_row_per_anchor_with_latest_values() {
        committed(apply(Map.of("added", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "users", "order", 1)),
                "fmodels", Map.of("1", Map.of("$anchor", "a-m1", "parentAnchor", "a-f1", "key", "id", "min", 1))))));
        committed(apply(Map.of("added", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "people", "order", 3)),
                "fmodels", Map.of("1", Map.of("$anchor", "a-m1", "parentAnchor", "a-f1", "key", "uid", "max", 2))))));

        Project p = reload();
        assertEquals(1, p.files().size());
        assertEquals(1, fmodelCount());
        ProjectFile f = p.files().get(0);
        assertEquals("people", f.key());
        assertEquals(3, f.order());
        Fmodel m = f.fmodels().get(0);
        assertEquals("uid", m.key());
        assertEquals(Map.of("max", 2), m.sch());
    }

    // ---------- ordering ----------

    @Test
    void fmodel_added_with_its_new_parent_gets_the_generated_file_id() {
        DiffResult.Summary s = committed(apply(Map.of("added", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "users")),
                "fmodels", Map.of("1", Map.of("$anchor", "a-m1", "type", "string", "parentAnchor", "a-f1"))))));

        assertEquals(1, s.filesAdded());
        assertEquals(1, s.fmodelsAdded());
        assertEquals(file("a-f1").id(), fmodel("a-m1").fileId());
    }

    @Test
    void nested_fields_default_their_parent_to_the_containing_file() {
        committed(apply(Map.of("added", Map.of("files", Map.of("1", Map.of(
                "$anchor", "a-f1", "key", "users",
                "fields", List.of(Map.of("$anchor", "a-m1", "type", "string", "format", "email"))))))));

        Fmodel m = fmodel("a-m1");
        assertEquals(file("a-f1").id(), m.fileId());
        assertEquals(Map.of("format", "email"), m.sch());
    }

    // ---------- translation ----------

    @Test
    void old_new_wrappers_store_the_new_value() {
        seedFile();
        committed(apply(Map.of("added", Map.of("fmodels", Map.of("1",
                Map.of("$anchor", "a-m1", "parentAnchor", "a-f1", "key", "a"))))));

        committed(apply(Map.of("changed", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "users", "order", Map.of("old", 1, "new", 2))),
                "fmodels", Map.of("1", Map.of("$anchor", "a-m1", "parentAnchor", "a-f1",
                        "key", Map.of("old", "a", "new", "b")))))));

        assertEquals(2, file("a-f1").order());
        assertEquals("b", fmodel("a-m1").key());
    }

    @Test
    void unrecognized_fmodel_keys_become_the_stored_sch() {
        seedFile();
        committed(apply(Map.of("added", Map.of("fmodels", Map.of("1", Map.of(
                "$anchor", "a-m1", "type", "object", "parentAnchor", "a-f1",
                "required", List.of("id"), "properties", Map.of("id", Map.of("type", "integer"))))))));

        assertEquals(Map.of("required", List.of("id"), "properties", Map.of("id", Map.of("type", "integer"))),
                fmodel("a-m1").sch());
    }

    @Test
    void changed_file_absent_fields_are_left_untouched() {
        seedFile();

        committed(apply(Map.of("changed", Map.of("files",
                Map.of("1", Map.of("$anchor", "a-f1", "key", "users"))))));

        assertEquals(1, file("a-f1").order());
    }

    @Test
    void changed_project_patches_only_given_attributes() {
        DiffResult.Summary s = committed(apply(Map.of("changed", Map.of("project",
                Map.of("$anchor", project.anchor(), "order", 4, "description", "v2")))));

        assertTrue(s.projectUpdated());
        Project p = reload();
        assertEquals(4, p.order());
        assertEquals("v2", p.description());
        assertEquals("P", p.key());
        assertEquals(project.anchor(), p.anchor());
    }

    // ---------- removal ----------

    @Test
    void removed_entries_delete_fmodels_then_files() {
        seedFile();
        committed(apply(Map.of("added", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f2", "key", "orders", "order", 2)),
                "fmodels", Map.of(
                        "1", Map.of("$anchor", "a-m1", "parentAnchor", "a-f1"),
                        "2", Map.of("$anchor", "a-m2", "parentAnchor", "a-f2"))))));

        DiffResult.Summary s = committed(apply(Map.of("removed", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f2")),
                "fmodels", Map.of("1", Map.of("$anchor", "a-m1"))))));

        assertEquals(1, s.fmodelsRemoved());
        assertEquals(1, s.filesRemoved());
        Project p = reload();
        assertEquals(List.of("a-f1"), p.files().stream().map(ProjectFile::anchor).toList());
        assertEquals(0, fmodelCount(), "a-m2 went with its file");
    }

    // ---------- rejections ----------

    @Test
    void malformed_entry_is_rejected_before_any_write() {
        DiffResult r = apply(Map.of("added", Map.of(
                "files", Map.of("1", Map.of("$anchor", "a-f1", "key", "users")),
                "fmodels", Map.of("1", Map.of("type", "object", "parentAnchor", "a-f1")))));

        DiffResult.Rejected rej = rejected(r);
        assertEquals(DiffResult.Reason.MALFORMED_ENTRY, rej.reason());
        assertNull(rej.offending());
        assertTrue(reload().files().isEmpty());
    }

    @Test
    void store_conflict_is_rejected_and_rolled_back() {
        seedFile();

        DiffResult r = apply(Map.of("added", Map.of("files", Map.of(
                "1", Map.of("$anchor", "a-f2", "key", "orders"),
                "2", Map.of("$anchor", "a-f3", "key", "users")))));

        assertEquals(DiffResult.Reason.CONFLICT_VIOLATION, rejected(r).reason());
        assertEquals(List.of("a-f1"), reload().files().stream().map(ProjectFile::anchor).toList());
    }

    @Test
    void empty_diff_commits_nothing() {
        DiffResult.Summary s = committed(apply(Map.of()));
        assertEquals(new DiffResult.Summary(false, 0, 0, 0, 0, 0, 0), s);
    }

    @Test
    void over_long_anchor_is_rejected_and_never_merges_with_a_prefix_twin() {
        String prefix = "x".repeat(255);
        String longKey = "k".repeat(300);

        DiffResult first = apply(Map.of("added", Map.of("files",
                Map.of("1", Map.of("$anchor", prefix + "A", "key", longKey)))));
        DiffResult second = apply(Map.of("added", Map.of("files",
                Map.of("1", Map.of("$anchor", prefix + "B", "key", "other")))));

        assertEquals(DiffResult.Reason.INVALID_VALUE, rejected(first).reason());
        assertEquals(DiffResult.Reason.INVALID_VALUE, rejected(second).reason());
        assertTrue(reload().files().isEmpty());
    }

    @Test
    void order_beyond_int_range_is_malformed() {
        DiffResult r = apply(Map.of("added", Map.of("files",
                Map.of("1", Map.of("$anchor", "a-f1", "key", "users", "order", 3_000_000_000L)))));

        assertEquals(DiffResult.Reason.MALFORMED_ENTRY, rejected(r).reason());
        assertTrue(reload().files().isEmpty());
    }

    @Test
    void any_other_store_failure_is_a_rejection() {
        ProjectRepository broken = new ProjectRepository() {
            @Override
            public Optional<Project> findByKey(String key) {
                return Optional.empty();
            }

            @Override
            public Optional<Project> findByAnchor(String anchor) {
                return Optional.empty();
            }

            @Override
            public Optional<Project> findByName(String name) {
                return Optional.empty();
            }

            @Override
            public Project create(NewProject p, LocalDateTime at) {
                throw new UnsupportedOperationException();
            }

            @Override
            public <T> TransactionOutcome<T> inTransaction(UnitOfWork<T> work) {
                throw new StorageException("transaction failed: connection lost", null);
            }
        };
        DiffReconciler onBrokenStore = new DiffReconciler(broken, ProjectDefaults.system());

        DiffResult r = onBrokenStore.persist(Diff.of(Map.of("added", Map.of("files",
                Map.of("1", Map.of("$anchor", "a-f1", "key", "users"))))), project);

        DiffResult.Rejected rej = rejected(r);
        assertEquals(DiffResult.Reason.STORE_FAILURE, rej.reason());
        assertTrue(rej.message().contains("connection lost"));
        assertNull(rej.offending());
    }

    // ---------- documented limitation ----------

    /**
     * Changed fmodels resolve against files that existed before the diff only.
     * A changed fmodel whose parent is added by the same diff is rejected.
     */
    @Test
    void changed_fmodel_cannot_reference_a_file_added_in_the_same_diff() {
        DiffResult r = apply(Map.of(
                "changed", Map.of("fmodels", Map.of("1", Map.of("$anchor", "a-m1", "parentAnchor", "a-f9"))),
                "added", Map.of("files", Map.of("1", Map.of("$anchor", "a-f9", "key", "late")))));

        DiffResult.Rejected rej = rejected(r);
        assertEquals(DiffResult.Reason.UNRESOLVED_PARENT, rej.reason());
        assertEquals("a-m1", rej.offending().anchor());
        assertTrue(reload().files().isEmpty());
    }
}
