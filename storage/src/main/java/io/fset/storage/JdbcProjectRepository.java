// file: storage/src/main/java/io/fset/storage/JdbcProjectRepository.java
package io.fset.storage;

import io.fset.core.model.Fmodel;
import io.fset.core.model.NewProject;
import io.fset.core.model.Project;
import io.fset.core.model.ProjectFile;
import org.h2.Driver;
import org.h2.jdbcx.JdbcConnectionPool;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * {@link ProjectRepository} backed by H2 through a JDBC connection pool.
 * <p>
 * Responsibilities:
 *  - Create the schema on startup if it is missing.
 *  - Load projects with their files and fmodels (three queries, no N+1).
 *  - Run units of work on a dedicated connection with auto-commit off, and
 *    commit or roll back exactly once on every exit path.
 */
public final class JdbcProjectRepository implements ProjectRepository, AutoCloseable {
    private static final Logger log = Logger.getLogger(JdbcProjectRepository.class.getName());

    private static final Pattern UUID_SHAPE =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final JdbcConnectionPool pool;
    private final SchCodec codec = new SchCodec();

    public JdbcProjectRepository(JdbcConnectionPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
        initialize();
    }

    /**
     * Open a pooled repository.
     *
     * @param url e.g. {@code jdbc:h2:./data/fset} or {@code jdbc:h2:mem:test;DB_CLOSE_DELAY=-1}
     */
    public static JdbcProjectRepository open(String url, String user, String password, int maxConnections) {
        Driver.load();
        JdbcConnectionPool cp = JdbcConnectionPool.create(url, user, password);
        cp.setMaxConnections(maxConnections);
        return new JdbcProjectRepository(cp);
    }

    private void initialize() {
        try (Connection con = pool.getConnection()) {
            Schema.create(con);
        } catch (SQLException e) {
            throw StorageException.translate("create schema", e);
        }
    }

    @Override
    public void close() {
        pool.dispose();
    }

    // ---------- lookups ----------

    @Override
    public Optional<Project> findByKey(String key) {
        return findOne("\"KEY\"", key);
    }

    @Override
    public Optional<Project> findByAnchor(String anchor) {
        return findOne("ANCHOR", anchor);
    }

    @Override
    public Optional<Project> findByName(String name) {
        Objects.requireNonNull(name, "name");
        if (UUID_SHAPE.matcher(name).matches()) {
            return findByAnchor(name.toLowerCase(Locale.ROOT));
        }
        return findByKey(name);
    }

    private Optional<Project> findOne(String column, String value) {
        String sql = "select ID, ANCHOR, \"KEY\", \"ORDER\", DESCRIPTION from PROJECTS where " + column + " = ?";
        try (Connection con = pool.getConnection();
             PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setString(1, value);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long id = rs.getLong("ID");
                return Optional.of(new Project(
                        id,
                        rs.getString("ANCHOR"),
                        rs.getString("KEY"),
                        rs.getInt("ORDER"),
                        rs.getString("DESCRIPTION"),
                        loadFiles(con, id)
                ));
            }
        } catch (SQLException e) {
            throw StorageException.translate("load project", e);
        }
    }

    private List<ProjectFile> loadFiles(Connection con, long projectId) throws SQLException {
        Map<Long, List<Fmodel>> fmodelsByFile = new HashMap<>();
        String fmodelSql = """
                select M.ID, M.ANCHOR, M.TYPE, M."KEY", M.IS_ENTRY, M.SCH, M.FILE_ID
                from FMODELS M join FILES F on M.FILE_ID = F.ID
                where F.PROJECT_ID = ?
                order by M.ID
                """;
        try (PreparedStatement ps = con.prepareStatement(fmodelSql)) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Fmodel m = new Fmodel(
                            rs.getLong("ID"),
                            rs.getString("ANCHOR"),
                            rs.getString("TYPE"),
                            rs.getString("KEY"),
                            rs.getBoolean("IS_ENTRY"),
                            codec.decode(rs.getString("SCH")),
                            rs.getLong("FILE_ID")
                    );
                    fmodelsByFile.computeIfAbsent(m.fileId(), k -> new ArrayList<>()).add(m);
                }
            }
        }

        List<ProjectFile> files = new ArrayList<>();
        String fileSql = """
                select ID, ANCHOR, "KEY", "ORDER", PROJECT_ID
                from FILES
                where PROJECT_ID = ?
                order by "ORDER", ID
                """;
        try (PreparedStatement ps = con.prepareStatement(fileSql)) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong("ID");
                    files.add(new ProjectFile(
                            id,
                            rs.getString("ANCHOR"),
                            rs.getString("KEY"),
                            rs.getInt("ORDER"),
                            rs.getLong("PROJECT_ID"),
                            fmodelsByFile.getOrDefault(id, List.of())
                    ));
                }
            }
        }
        return files;
    }

    // ---------- provisioning ----------

    @Override
    public Project create(NewProject project, LocalDateTime at) {
        Objects.requireNonNull(project.anchor(), "anchor");
        Objects.requireNonNull(project.key(), "key");
        int order = project.order() == null ? 0 : project.order();

        String sql = """
                insert into PROJECTS (ANCHOR, "KEY", "ORDER", DESCRIPTION, INSERTED_AT, UPDATED_AT)
                values (?, ?, ?, ?, ?, ?)
                """;
        try (Connection con = pool.getConnection();
             PreparedStatement ps = con.prepareStatement(sql, new String[]{"ID"})) {
            ps.setString(1, project.anchor());
            ps.setString(2, project.key());
            ps.setInt(3, order);
            if (project.description() == null) {
                ps.setNull(4, Types.VARCHAR);
            } else {
                ps.setString(4, project.description());
            }
            ps.setObject(5, at);
            ps.setObject(6, at);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StorageException("create project returned no id", null);
                }
                return new Project(keys.getLong(1), project.anchor(), project.key(), order,
                        project.description(), List.of());
            }
        } catch (SQLException e) {
            throw StorageException.translate("create project " + project.key(), e);
        }
    }

    // ---------- transactions ----------

    @Override
    public <T> TransactionOutcome<T> inTransaction(UnitOfWork<T> work) {
        Objects.requireNonNull(work, "work");
        try (Connection con = pool.getConnection()) {
            con.setAutoCommit(false);
            try {
                JdbcTransaction tx = new JdbcTransaction(con, codec);
                T value = work.run(tx);
                if (tx.isAborted()) {
                    con.rollback();
                    return new TransactionOutcome.Aborted<>(tx.abortReason());
                }
                con.commit();
                return new TransactionOutcome.Committed<>(value);
            } catch (RuntimeException | SQLException e) {
                rollback(con, e);
                throw e;
            } finally {
                con.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw StorageException.translate("transaction", e);
        }
    }

    /** Roll back after a failure; a failing rollback is attached to the original error. */
    private static void rollback(Connection con, Exception cause) {
        try {
            con.rollback();
        } catch (SQLException rollbackFailure) {
            log.log(Level.WARNING, "rollback failed", rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }
}
