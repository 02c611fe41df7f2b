package com.scriptorium.core.persistence;

import com.scriptorium.core.error.InfrastructureException;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.BranchStatus;
import com.scriptorium.core.model.FileRecord;
import com.scriptorium.core.model.FileType;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.model.RepositoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based {@link IndexStore} persisting the index to PostgreSQL.
 * <p>
 * The tables are created automatically via {@link #createTables()}. Upserts are
 * written as UPDATE-then-INSERT so the same SQL runs on PostgreSQL and on H2.
 */
public class JdbcIndexStore implements IndexStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcIndexStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS repositories (
                id                UUID PRIMARY KEY,
                project_id        UUID NOT NULL UNIQUE,
                repo_path         VARCHAR(1024) NOT NULL,
                default_branch_id UUID,
                last_commit_hash  VARCHAR(64),
                initialized       BOOLEAN NOT NULL DEFAULT FALSE,
                created_at        TIMESTAMP NOT NULL,
                updated_at        TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS branches (
                id               UUID PRIMARY KEY,
                project_id       UUID NOT NULL,
                name             VARCHAR(100) NOT NULL,
                description      TEXT,
                source_branch_id UUID,
                head_commit_hash VARCHAR(64),
                status           VARCHAR(20) NOT NULL DEFAULT 'active',
                is_default       BOOLEAN NOT NULL DEFAULT FALSE,
                is_protected     BOOLEAN NOT NULL DEFAULT FALSE,
                created_by       UUID,
                created_at       TIMESTAMP NOT NULL,
                updated_at       TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS branch_permissions (
                branch_id  UUID NOT NULL,
                user_id    UUID NOT NULL,
                can_read   BOOLEAN NOT NULL DEFAULT FALSE,
                can_write  BOOLEAN NOT NULL DEFAULT FALSE,
                can_admin  BOOLEAN NOT NULL DEFAULT FALSE,
                granted_by UUID,
                granted_at TIMESTAMP NOT NULL,
                PRIMARY KEY (branch_id, user_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS branch_files (
                id               UUID PRIMARY KEY,
                project_id       UUID NOT NULL,
                branch_id        UUID NOT NULL,
                file_path        VARCHAR(1024) NOT NULL,
                file_name        VARCHAR(255) NOT NULL,
                file_type        VARCHAR(20) NOT NULL,
                file_size        BIGINT NOT NULL DEFAULT 0,
                encoding         VARCHAR(20) NOT NULL DEFAULT 'utf-8',
                created_by       UUID,
                last_modified_by UUID,
                created_at       TIMESTAMP NOT NULL,
                updated_at       TIMESTAMP NOT NULL,
                deleted_at       TIMESTAMP,
                UNIQUE (branch_id, file_path)
            )
            """
    );

    private static final String REPOSITORY_COLUMNS =
            "id, project_id, repo_path, default_branch_id, last_commit_hash, initialized, created_at, updated_at";

    private static final String BRANCH_COLUMNS =
            "id, project_id, name, description, source_branch_id, head_commit_hash, status, "
                    + "is_default, is_protected, created_by, created_at, updated_at";

    private static final String FILE_COLUMNS =
            "id, project_id, branch_id, file_path, file_name, file_type, file_size, encoding, "
                    + "created_by, last_modified_by, created_at, updated_at, deleted_at";

    private static final String INSERT_REPOSITORY_SQL =
            "INSERT INTO repositories (" + REPOSITORY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_REPOSITORY_SQL = """
            UPDATE repositories
            SET repo_path = ?, default_branch_id = ?, last_commit_hash = ?, initialized = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String SELECT_REPOSITORY_SQL =
            "SELECT " + REPOSITORY_COLUMNS + " FROM repositories WHERE project_id = ?";

    private static final String INSERT_BRANCH_SQL =
            "INSERT INTO branches (" + BRANCH_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_BRANCH_SQL =
            "SELECT " + BRANCH_COLUMNS + " FROM branches WHERE id = ?";

    private static final String SELECT_BRANCH_BY_NAME_SQL =
            "SELECT " + BRANCH_COLUMNS + " FROM branches WHERE project_id = ? AND name = ? AND status <> 'deleted'";

    private static final String LIST_BRANCHES_SQL = """
            SELECT %s FROM branches
            WHERE project_id = ? AND status <> 'deleted'
            ORDER BY created_at ASC, name ASC
            LIMIT ? OFFSET ?
            """.formatted(BRANCH_COLUMNS);

    private static final String COUNT_BRANCHES_SQL =
            "SELECT COUNT(*) FROM branches WHERE project_id = ? AND status <> 'deleted'";

    private static final String UPDATE_BRANCH_HEAD_SQL =
            "UPDATE branches SET head_commit_hash = ?, updated_at = ? WHERE id = ?";

    private static final String SELECT_PERMISSION_SQL = """
            SELECT branch_id, user_id, can_read, can_write, can_admin, granted_by, granted_at
            FROM branch_permissions WHERE branch_id = ? AND user_id = ?
            """;

    private static final String LIST_PERMISSIONS_SQL = """
            SELECT branch_id, user_id, can_read, can_write, can_admin, granted_by, granted_at
            FROM branch_permissions WHERE branch_id = ? ORDER BY granted_at ASC
            """;

    private static final String UPDATE_PERMISSION_SQL = """
            UPDATE branch_permissions
            SET can_read = ?, can_write = ?, can_admin = ?, granted_by = ?, granted_at = ?
            WHERE branch_id = ? AND user_id = ?
            """;

    private static final String INSERT_PERMISSION_SQL = """
            INSERT INTO branch_permissions (can_read, can_write, can_admin, granted_by, granted_at, branch_id, user_id)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_FILE_SQL =
            "SELECT " + FILE_COLUMNS + " FROM branch_files WHERE branch_id = ? AND file_path = ?";

    private static final String LIST_FILES_SQL =
            "SELECT " + FILE_COLUMNS + " FROM branch_files WHERE branch_id = ? AND deleted_at IS NULL ORDER BY file_path";

    private static final String COUNT_FILES_SQL =
            "SELECT COUNT(*) FROM branch_files WHERE branch_id = ? AND deleted_at IS NULL";

    private static final String UPDATE_FILE_SQL = """
            UPDATE branch_files
            SET file_name = ?, file_type = ?, file_size = ?, encoding = ?, last_modified_by = ?,
                updated_at = ?, deleted_at = ?
            WHERE branch_id = ? AND file_path = ?
            """;

    private static final String INSERT_FILE_SQL =
            "INSERT INTO branch_files (" + FILE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final DataSource dataSource;

    public JdbcIndexStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the index tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Index tables ensured");
        }
    }

    // -- Repositories --

    @Override
    public Optional<RepositoryRecord> findRepository(UUID projectId) {
        return queryOne(SELECT_REPOSITORY_SQL, JdbcIndexStore::toRepository, projectId);
    }

    @Override
    public void createRepository(RepositoryRecord repository, Branch mainBranch, BranchPermission ownerGrant) {
        inTransaction("create repository for project " + repository.projectId(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_REPOSITORY_SQL)) {
                stmt.setObject(1, repository.id());
                stmt.setObject(2, repository.projectId());
                stmt.setString(3, repository.repoPath());
                stmt.setObject(4, repository.defaultBranchId());
                stmt.setString(5, repository.lastCommitHash());
                stmt.setBoolean(6, repository.initialized());
                stmt.setTimestamp(7, ts(repository.createdAt()));
                stmt.setTimestamp(8, ts(repository.updatedAt()));
                stmt.executeUpdate();
            }
            insertBranch(conn, mainBranch);
            writePermission(conn, ownerGrant);
        });
    }

    @Override
    public void updateRepository(RepositoryRecord repository) {
        update("update repository " + repository.id(), UPDATE_REPOSITORY_SQL,
                repository.repoPath(), repository.defaultBranchId(), repository.lastCommitHash(),
                repository.initialized(), ts(repository.updatedAt()), repository.id());
    }

    // -- Branches --

    @Override
    public Optional<Branch> findBranch(UUID branchId) {
        return queryOne(SELECT_BRANCH_SQL, JdbcIndexStore::toBranch, branchId);
    }

    @Override
    public Optional<Branch> findBranchByName(UUID projectId, String name) {
        return queryOne(SELECT_BRANCH_BY_NAME_SQL, JdbcIndexStore::toBranch, projectId, name);
    }

    @Override
    public List<Branch> listBranches(UUID projectId, int offset, int limit) {
        return queryList(LIST_BRANCHES_SQL, JdbcIndexStore::toBranch, projectId, limit, offset);
    }

    @Override
    public int countBranches(UUID projectId) {
        return queryOne(COUNT_BRANCHES_SQL, rs -> rs.getInt(1), projectId).orElse(0);
    }

    @Override
    public void insertBranch(Branch branch, BranchPermission creatorGrant) {
        inTransaction("insert branch " + branch.name(), conn -> {
            insertBranch(conn, branch);
            writePermission(conn, creatorGrant);
        });
    }

    @Override
    public void updateBranchHead(UUID branchId, String commitHash, Instant at) {
        update("update head of branch " + branchId, UPDATE_BRANCH_HEAD_SQL, commitHash, ts(at), branchId);
    }

    // -- Permissions --

    @Override
    public Optional<BranchPermission> findPermission(UUID branchId, UUID userId) {
        return queryOne(SELECT_PERMISSION_SQL, JdbcIndexStore::toPermission, branchId, userId);
    }

    @Override
    public void upsertPermission(BranchPermission permission) {
        inTransaction("grant permission on branch " + permission.branchId(),
                conn -> writePermission(conn, permission));
    }

    @Override
    public List<BranchPermission> listPermissions(UUID branchId) {
        return queryList(LIST_PERMISSIONS_SQL, JdbcIndexStore::toPermission, branchId);
    }

    // -- Files --

    @Override
    public Optional<FileRecord> findFile(UUID branchId, String path) {
        return queryOne(SELECT_FILE_SQL, JdbcIndexStore::toFile, branchId, path);
    }

    @Override
    public List<FileRecord> listFiles(UUID branchId) {
        return queryList(LIST_FILES_SQL, JdbcIndexStore::toFile, branchId);
    }

    @Override
    public int countFiles(UUID branchId) {
        return queryOne(COUNT_FILES_SQL, rs -> rs.getInt(1), branchId).orElse(0);
    }

    @Override
    public void saveFile(FileRecord file) {
        inTransaction("save file record " + file.path(), conn -> {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_FILE_SQL)) {
                bind(stmt, file.name(), file.type().dbValue(), file.size(), file.encoding(),
                        file.lastModifiedBy(), ts(file.updatedAt()), ts(file.deletedAt()),
                        file.branchId(), file.path());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_FILE_SQL)) {
                    bind(stmt, file.id(), file.projectId(), file.branchId(), file.path(), file.name(),
                            file.type().dbValue(), file.size(), file.encoding(), file.createdBy(),
                            file.lastModifiedBy(), ts(file.createdAt()), ts(file.updatedAt()),
                            ts(file.deletedAt()));
                    stmt.executeUpdate();
                }
            }
        });
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    // -- Helpers --

    private void insertBranch(Connection conn, Branch branch) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_BRANCH_SQL)) {
            bind(stmt, branch.id(), branch.projectId(), branch.name(), branch.description(),
                    branch.sourceBranchId(), branch.headCommitHash(), branch.status().dbValue(),
                    branch.isDefault(), branch.isProtected(), branch.createdBy(),
                    ts(branch.createdAt()), ts(branch.updatedAt()));
            stmt.executeUpdate();
        }
    }

    private void writePermission(Connection conn, BranchPermission permission) throws SQLException {
        PermissionFlags flags = permission.flags();
        Object[] params = {flags.canRead(), flags.canWrite(), flags.canAdmin(), permission.grantedBy(),
                ts(permission.grantedAt()), permission.branchId(), permission.userId()};
        int updated;
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_PERMISSION_SQL)) {
            bind(stmt, params);
            updated = stmt.executeUpdate();
        }
        if (updated == 0) {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_PERMISSION_SQL)) {
                bind(stmt, params);
                stmt.executeUpdate();
            }
        }
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlWork {
        void run(Connection conn) throws SQLException;
    }

    private <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = queryList(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private <T> List<T> queryList(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Index query failed: {}", sql.strip(), e);
            throw new InfrastructureException("Index store query failed", e);
        }
        return rows;
    }

    private void update(String description, String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to {}", description, e);
            throw new InfrastructureException("Index store update failed: " + description, e);
        }
    }

    private void inTransaction(String description, SqlWork work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to {}", description, e);
            throw new InfrastructureException("Index store transaction failed: " + description, e);
        }
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            stmt.setObject(i + 1, params[i]);
        }
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    private static RepositoryRecord toRepository(ResultSet rs) throws SQLException {
        return new RepositoryRecord(
                uuid(rs, "id"),
                uuid(rs, "project_id"),
                rs.getString("repo_path"),
                uuid(rs, "default_branch_id"),
                rs.getString("last_commit_hash"),
                rs.getBoolean("initialized"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    private static Branch toBranch(ResultSet rs) throws SQLException {
        return new Branch(
                uuid(rs, "id"),
                uuid(rs, "project_id"),
                rs.getString("name"),
                rs.getString("description"),
                uuid(rs, "source_branch_id"),
                rs.getString("head_commit_hash"),
                BranchStatus.fromDbValue(rs.getString("status")),
                rs.getBoolean("is_default"),
                rs.getBoolean("is_protected"),
                uuid(rs, "created_by"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    private static BranchPermission toPermission(ResultSet rs) throws SQLException {
        return new BranchPermission(
                uuid(rs, "branch_id"),
                uuid(rs, "user_id"),
                new PermissionFlags(rs.getBoolean("can_read"), rs.getBoolean("can_write"), rs.getBoolean("can_admin")),
                uuid(rs, "granted_by"),
                instant(rs, "granted_at"));
    }

    private static FileRecord toFile(ResultSet rs) throws SQLException {
        return new FileRecord(
                uuid(rs, "id"),
                uuid(rs, "project_id"),
                uuid(rs, "branch_id"),
                rs.getString("file_path"),
                rs.getString("file_name"),
                FileType.fromDbValue(rs.getString("file_type")),
                rs.getLong("file_size"),
                rs.getString("encoding"),
                uuid(rs, "created_by"),
                uuid(rs, "last_modified_by"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "deleted_at"));
    }
}
