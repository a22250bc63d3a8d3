package com.telcobright.archive.db.catalog;

import com.telcobright.archive.core.exception.ConfigurationException;
import com.telcobright.archive.core.metadata.ForeignKeyMetadata;
import com.telcobright.archive.core.metadata.SampleTableMetadata;
import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.Granularity;
import com.telcobright.archive.core.routing.DispatchRoutine;
import com.telcobright.archive.core.sql.postgresql.PostgreSQLDdlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * PartitionCatalog on PostgreSQL table inheritance.
 *
 * Uses pg_catalog to find existing buckets, the routine and the trigger.
 * Every mutating call runs in its own transaction on a pooled connection.
 */
public class PostgreSQLPartitionCatalog implements PartitionCatalog {

    private static final Logger logger = LoggerFactory.getLogger(PostgreSQLPartitionCatalog.class);

    /** SQLSTATE undefined_object, e.g. a missing role */
    private static final String UNDEFINED_OBJECT = "42704";
    /** SQLSTATE undefined_table */
    private static final String UNDEFINED_TABLE = "42P01";
    /** SQLSTATE invalid_schema_name */
    private static final String INVALID_SCHEMA_NAME = "3F000";

    private static final String ROLE_EXISTS = "SELECT 1 FROM pg_roles WHERE rolname = ?";

    private static final String TABLE_EXISTS = """
        SELECT 1
        FROM pg_class c
        JOIN pg_namespace n ON n.oid = c.relnamespace
        WHERE n.nspname = ? AND c.relname = ? AND c.relkind IN ('r', 'p')
        """;

    private static final String CHILD_TABLES = """
        SELECT child.relname
        FROM pg_inherits i
        JOIN pg_class parent ON parent.oid = i.inhparent
        JOIN pg_class child ON child.oid = i.inhrelid
        JOIN pg_namespace np ON np.oid = parent.relnamespace
        JOIN pg_namespace nc ON nc.oid = child.relnamespace
        WHERE np.nspname = ? AND parent.relname = ? AND nc.nspname = ?
        """;

    private static final String ROUTINE_COMMENT = """
        SELECT d.description
        FROM pg_proc p
        JOIN pg_namespace n ON n.oid = p.pronamespace
        LEFT JOIN pg_description d ON d.objoid = p.oid AND d.classoid = 'pg_proc'::regclass
        WHERE n.nspname = ? AND p.proname = ? AND p.pronargs = 0
        """;

    private static final String TRIGGER_EXISTS = """
        SELECT 1
        FROM pg_trigger t
        JOIN pg_class c ON c.oid = t.tgrelid
        JOIN pg_namespace n ON n.oid = c.relnamespace
        WHERE n.nspname = ? AND c.relname = ? AND t.tgname = ? AND NOT t.tgisinternal
        """;

    private final DataSource dataSource;
    private final PostgreSQLDdlGenerator ddl;

    public PostgreSQLPartitionCatalog(DataSource dataSource, PostgreSQLDdlGenerator ddl) {
        this.dataSource = dataSource;
        this.ddl = ddl;
    }

    @Override
    public void verifyPrerequisites(String schema, String owner) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            if (!exists(conn, ROLE_EXISTS, owner)) {
                throw new ConfigurationException("Owner role does not exist: " + owner);
            }
            if (!exists(conn, TABLE_EXISTS, schema, SampleTableMetadata.TABLE_NAME)) {
                throw new ConfigurationException("Parent table does not exist: "
                    + schema + "." + SampleTableMetadata.TABLE_NAME);
            }
            for (ForeignKeyMetadata foreignKey : SampleTableMetadata.getForeignKeys()) {
                if (!exists(conn, TABLE_EXISTS, schema, foreignKey.getReferencedTable())) {
                    throw new ConfigurationException(String.format(
                        "Lookup relation %s.%s referenced by %s does not exist",
                        schema, foreignKey.getReferencedTable(), foreignKey.getColumnName()));
                }
            }
        }
    }

    @Override
    public boolean bucketExists(String schema, Bucket bucket) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return exists(conn, TABLE_EXISTS, schema, bucket.getName());
        }
    }

    @Override
    public void createBucket(String schema, String owner, Bucket bucket) throws SQLException {
        List<String> statements = ddl.generateBucketStatements(schema, owner, bucket);
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : statements) {
                    logger.debug("Executing: {}", sql);
                    stmt.execute(sql);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                String context = "Failed to create bucket " + schema + "." + bucket.getName();
                if (isMissingObject(e)) {
                    throw new ConfigurationException(context + ": " + e.getMessage(), e);
                }
                throw new SQLException(context + ": " + e.getMessage(), e.getSQLState(), e.getErrorCode(), e);
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
    }

    @Override
    public List<Bucket> listBuckets(String schema, Granularity granularity) throws SQLException {
        List<Bucket> buckets = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CHILD_TABLES)) {
            stmt.setString(1, schema);
            stmt.setString(2, SampleTableMetadata.TABLE_NAME);
            stmt.setString(3, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String tableName = rs.getString(1);
                    Optional<Bucket> bucket = Bucket.fromTableName(tableName, granularity);
                    if (bucket.isPresent()) {
                        buckets.add(bucket.get());
                    } else {
                        logger.debug("Ignoring child table {} (not a {} bucket)", tableName, granularity.getPlan());
                    }
                }
            }
        }
        Collections.sort(buckets);
        return buckets;
    }

    @Override
    public Optional<String> installedRoutineComment(String schema) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ROUTINE_COMMENT)) {
            stmt.setString(1, schema);
            stmt.setString(2, SampleTableMetadata.ROUTINE_NAME);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean insertHookExists(String schema) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return hookExists(conn, schema);
        }
    }

    @Override
    public boolean replaceRoutine(String schema, DispatchRoutine routine) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(routine.getSource());
                stmt.execute(ddl.generateCommentOnRoutine(schema, routine.getHashComment()));
                boolean installHook = !hookExists(conn, schema);
                if (installHook) {
                    stmt.execute(ddl.generateCreateTrigger(schema));
                }
                conn.commit();
                return installHook;
            } catch (SQLException e) {
                conn.rollback();
                String context = "Failed to replace dispatch routine in schema " + schema;
                if (isMissingObject(e)) {
                    throw new ConfigurationException(context + ": " + e.getMessage(), e);
                }
                throw new SQLException(context + ": " + e.getMessage(), e.getSQLState(), e.getErrorCode(), e);
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
    }

    private boolean hookExists(Connection conn, String schema) throws SQLException {
        return exists(conn, TRIGGER_EXISTS, schema, SampleTableMetadata.TABLE_NAME, SampleTableMetadata.TRIGGER_NAME);
    }

    private boolean exists(Connection conn, String query, String... parameters) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(query)) {
            for (int i = 0; i < parameters.length; i++) {
                stmt.setString(i + 1, parameters[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Missing roles, schemas and relations are configuration errors
     */
    private static boolean isMissingObject(SQLException e) {
        String state = e.getSQLState();
        return UNDEFINED_OBJECT.equals(state) || UNDEFINED_TABLE.equals(state) || INVALID_SCHEMA_NAME.equals(state);
    }
}
