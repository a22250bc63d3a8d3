package com.telcobright.archive.core.sql.postgresql;

import com.telcobright.archive.core.metadata.ColumnMetadata;
import com.telcobright.archive.core.metadata.ForeignKeyMetadata;
import com.telcobright.archive.core.metadata.SampleTableMetadata;
import com.telcobright.archive.core.partition.Bucket;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * PostgreSQL DDL for the sample table and its inheritance-based buckets.
 *
 * Buckets are plain child tables (INHERITS) bounded by a CHECK constraint so
 * that constraint exclusion can skip them in range queries.
 */
public class PostgreSQLDdlGenerator {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * CREATE TABLE IF NOT EXISTS for the parent sample table
     */
    public String generateCreateParentTable(String schema) {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ");
        sql.append(qualify(schema, SampleTableMetadata.TABLE_NAME)).append(" (\n");

        List<ColumnMetadata> columns = SampleTableMetadata.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            sql.append("  ").append(columns.get(i).getColumnDefinition());
            if (i < columns.size() - 1) {
                sql.append(",");
            }
            sql.append("\n");
        }
        sql.append(")");
        return sql.toString();
    }

    /**
     * Child table inheriting the parent columns, bounded to [start, end)
     */
    public String generateCreateBucketTable(String schema, Bucket bucket) {
        return String.format("CREATE TABLE %s (CONSTRAINT %s CHECK (%s >= %s AND %s < %s)) INHERITS (%s)",
            qualify(schema, bucket.getName()),
            escapeIdentifier(SampleTableMetadata.checkConstraintName(bucket.getName())),
            SampleTableMetadata.TIME_COLUMN,
            timestampLiteral(bucket.getStart()),
            SampleTableMetadata.TIME_COLUMN,
            timestampLiteral(bucket.getEnd()),
            qualify(schema, SampleTableMetadata.TABLE_NAME));
    }

    public String generateAlterOwner(String schema, String tableName, String owner) {
        return String.format("ALTER TABLE %s OWNER TO %s",
            qualify(schema, tableName), escapeIdentifier(owner));
    }

    /**
     * Composite (channel_id, smpl_time, nanosecs) index on a bucket
     */
    public String generateCreateBucketIndex(String schema, String tableName) {
        String columnList = SampleTableMetadata.getIndexColumns().stream()
                .map(this::escapeIdentifier)
                .collect(Collectors.joining(", "));
        return String.format("CREATE INDEX %s ON %s (%s)",
            escapeIdentifier(SampleTableMetadata.indexName(tableName)),
            qualify(schema, tableName),
            columnList);
    }

    public String generateAddForeignKey(String schema, String tableName, ForeignKeyMetadata foreignKey) {
        return String.format("ALTER TABLE %s ADD CONSTRAINT %s FOREIGN KEY (%s) REFERENCES %s(%s) ON DELETE CASCADE",
            qualify(schema, tableName),
            escapeIdentifier(foreignKey.constraintName(tableName)),
            escapeIdentifier(foreignKey.getColumnName()),
            qualify(schema, foreignKey.getReferencedTable()),
            escapeIdentifier(foreignKey.getReferencedColumn()));
    }

    /**
     * Every statement that materializes one bucket, in execution order.
     * Meant to run inside a single transaction.
     */
    public List<String> generateBucketStatements(String schema, String owner, Bucket bucket) {
        List<String> statements = new ArrayList<>();
        statements.add(generateCreateBucketTable(schema, bucket));
        statements.add(generateAlterOwner(schema, bucket.getName(), owner));
        statements.add(generateCreateBucketIndex(schema, bucket.getName()));
        for (ForeignKeyMetadata foreignKey : SampleTableMetadata.getForeignKeys()) {
            statements.add(generateAddForeignKey(schema, bucket.getName(), foreignKey));
        }
        return statements;
    }

    public String generateCreateTrigger(String schema) {
        return String.format("CREATE TRIGGER %s BEFORE INSERT ON %s FOR EACH ROW EXECUTE PROCEDURE %s()",
            escapeIdentifier(SampleTableMetadata.TRIGGER_NAME),
            qualify(schema, SampleTableMetadata.TABLE_NAME),
            qualify(schema, SampleTableMetadata.ROUTINE_NAME));
    }

    public String generateCommentOnRoutine(String schema, String comment) {
        return String.format("COMMENT ON FUNCTION %s() IS %s",
            qualify(schema, SampleTableMetadata.ROUTINE_NAME), escapeLiteral(comment));
    }

    public String qualify(String schema, String name) {
        return escapeIdentifier(schema) + "." + escapeIdentifier(name);
    }

    public String escapeIdentifier(String identifier) {
        // PostgreSQL uses double quotes for identifiers
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public String escapeLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public String timestampLiteral(LocalDateTime timestamp) {
        return "TIMESTAMP '" + timestamp.format(TIMESTAMP_FORMAT) + "'";
    }
}
