// file: storage/src/main/java/io/fset/storage/JdbcTransaction.java
package io.fset.storage;

import io.fset.core.diff.FilePatch;
import io.fset.core.diff.FmodelPatch;
import io.fset.core.diff.ProjectPatch;
import io.fset.core.model.FileRef;
import io.fset.core.reconcile.ResolvedFmodel;
import io.fset.core.reconcile.UpsertPolicy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transaction} bound to one JDBC connection with auto-commit off.
 * Commit and rollback belong to {@link JdbcProjectRepository}.
 */
final class JdbcTransaction implements Transaction {
    private static final Logger log = Logger.getLogger(JdbcTransaction.class.getName());

    private final Connection con;
    private final SchCodec codec;

    private boolean aborted;
    private Object abortReason;

    JdbcTransaction(Connection con, SchCodec codec) {
        this.con = con;
        this.codec = codec;
    }

    @Override
    public int updateProject(long projectId, ProjectPatch patch, LocalDateTime at) {
        ensureActive();
        if (patch.isEmpty()) {
            return 0;
        }

        List<String> sets = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        patch.key().ifPresent(k -> {
            sets.add("\"KEY\" = ?");
            params.add(k);
        });
        patch.order().ifPresent(o -> {
            sets.add("\"ORDER\" = ?");
            params.add(o);
        });
        patch.description().ifPresent(d -> {
            sets.add("DESCRIPTION = ?");
            params.add(d);
        });
        sets.add("UPDATED_AT = ?");
        params.add(at);

        String sql = "update PROJECTS set " + String.join(", ", sets) + " where ID = ?";
        try (PreparedStatement ps = con.prepareStatement(sql)) {
            int i = 1;
            for (Object p : params) {
                ps.setObject(i++, p);
            }
            ps.setLong(i, projectId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw StorageException.translate("update project " + projectId, e);
        }
    }

    @Override
    public List<FileRef> upsertFiles(long projectId, List<FilePatch> files, UpsertPolicy policy,
                                     LocalDateTime at, boolean returning) {
        ensureActive();
        requireEntity(policy, UpsertPolicy.Entity.FILE);
        if (files.isEmpty()) {
            return List.of();
        }

        try (PreparedStatement ps = con.prepareStatement(UpsertSql.merge(policy))) {
            for (FilePatch f : files) {
                ps.setString(1, f.anchor());
                setNullable(ps, 2, f.key().orElse(null), Types.VARCHAR);
                setNullable(ps, 3, f.order().orElse(null), Types.INTEGER);
                ps.setLong(4, projectId);
                ps.setObject(5, at);
                ps.setObject(6, at);
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw StorageException.translate("upsert files (" + policy + ")", e);
        }
        log.log(Level.FINE, "upserted {0} file(s) with {1}", new Object[]{files.size(), policy});

        if (!returning) {
            return List.of();
        }
        List<String> anchors = new ArrayList<>(files.size());
        for (FilePatch f : files) {
            anchors.add(f.anchor());
        }
        return readFileRefs(anchors);
    }

    @Override
    public int upsertFmodels(List<ResolvedFmodel> fmodels, UpsertPolicy policy) {
        ensureActive();
        requireEntity(policy, UpsertPolicy.Entity.FMODEL);
        if (fmodels.isEmpty()) {
            return 0;
        }

        try (PreparedStatement ps = con.prepareStatement(UpsertSql.merge(policy))) {
            for (ResolvedFmodel r : fmodels) {
                FmodelPatch m = r.patch();
                ps.setString(1, m.anchor());
                setNullable(ps, 2, m.type().orElse(null), Types.VARCHAR);
                setNullable(ps, 3, m.key().orElse(null), Types.VARCHAR);
                setNullable(ps, 4, m.isEntry().orElse(null), Types.BOOLEAN);
                ps.setString(5, codec.encode(m.sch()));
                ps.setLong(6, r.fileId());
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw StorageException.translate("upsert fmodels (" + policy + ")", e);
        }
        log.log(Level.FINE, "upserted {0} fmodel(s) with {1}", new Object[]{fmodels.size(), policy});
        return fmodels.size();
    }

    @Override
    public int deleteFiles(long projectId, Collection<String> anchors) {
        ensureActive();
        if (anchors.isEmpty()) {
            return 0;
        }
        String sql = "delete from FILES where PROJECT_ID = ? and ANCHOR in ("
                + UpsertSql.placeholders(anchors.size()) + ")";
        try (PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            int i = 2;
            for (String a : anchors) {
                ps.setString(i++, a);
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw StorageException.translate("delete files", e);
        }
    }

    @Override
    public int deleteFmodels(Collection<String> anchors) {
        ensureActive();
        if (anchors.isEmpty()) {
            return 0;
        }
        String sql = "delete from FMODELS where ANCHOR in (" + UpsertSql.placeholders(anchors.size()) + ")";
        try (PreparedStatement ps = con.prepareStatement(sql)) {
            int i = 1;
            for (String a : anchors) {
                ps.setString(i++, a);
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw StorageException.translate("delete fmodels", e);
        }
    }

    @Override
    public void abort(Object reason) {
        ensureActive();
        this.aborted = true;
        this.abortReason = Objects.requireNonNull(reason, "reason");
    }

    @Override
    public boolean isAborted() {
        return aborted;
    }

    Object abortReason() {
        return abortReason;
    }

    // ---------- helpers ----------

    /** Id and anchor of the files with the given anchors, in the order the anchors were given. */
    private List<FileRef> readFileRefs(List<String> anchors) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(anchors));
        String sql = "select ID, ANCHOR from FILES where ANCHOR in (" + UpsertSql.placeholders(distinct.size()) + ")";

        Map<String, Long> ids = new HashMap<>();
        try (PreparedStatement ps = con.prepareStatement(sql)) {
            int i = 1;
            for (String a : distinct) {
                ps.setString(i++, a);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.put(rs.getString("ANCHOR"), rs.getLong("ID"));
                }
            }
        } catch (SQLException e) {
            throw StorageException.translate("read upserted files", e);
        }

        List<FileRef> out = new ArrayList<>(distinct.size());
        for (String a : distinct) {
            Long id = ids.get(a);
            if (id != null) {
                out.add(new FileRef(id, a));
            }
        }
        return out;
    }

    private void ensureActive() {
        if (aborted) {
            throw new IllegalStateException("transaction already aborted");
        }
    }

    private static void requireEntity(UpsertPolicy policy, UpsertPolicy.Entity expected) {
        if (policy.entity() != expected) {
            throw new IllegalArgumentException("policy " + policy + " does not apply to " + expected);
        }
    }

    private static void setNullable(PreparedStatement ps, int index, Object value, int sqlType) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType);
        } else {
            ps.setObject(index, value, sqlType);
        }
    }
}
