package com.telcobright.archive.db.repository;

import com.telcobright.archive.core.metadata.ColumnMetadata;
import com.telcobright.archive.core.metadata.SampleTableMetadata;
import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.routing.DispatchTable;
import com.telcobright.archive.core.sql.postgresql.PostgreSQLDdlGenerator;
import com.telcobright.archive.db.entity.Sample;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.stream.Collectors;

/**
 * Writes samples either through the parent table, where the insert hook
 * routes them, or straight into the bucket chosen by an application-side
 * dispatch table.
 */
public class SampleRepository {
    
    private static final String COLUMN_LIST = SampleTableMetadata.getColumns().stream()
        .map(ColumnMetadata::getColumnName)
        .collect(Collectors.joining(", "));
    private static final String PLACEHOLDERS = SampleTableMetadata.getColumns().stream()
        .map(c -> "?")
        .collect(Collectors.joining(", "));
    
    private final DataSource dataSource;
    private final String schema;
    private final PostgreSQLDdlGenerator ddl = new PostgreSQLDdlGenerator();
    
    public SampleRepository(DataSource dataSource, String schema) {
        this.dataSource = dataSource;
        this.schema = schema;
    }
    
    /**
     * Insert into the parent table. The dispatch routine moves the row into
     * its bucket, or the insert fails if no bucket covers the sample time.
     */
    public void insert(Sample sample) throws SQLException {
        insertInto(SampleTableMetadata.TABLE_NAME, sample);
    }
    
    /**
     * Insert directly into the bucket the dispatch table picks.
     *
     * @return the bucket the sample was written to
     * @throws com.telcobright.archive.core.exception.OutOfRangeException if no bucket covers the sample time
     */
    public Bucket insertRouted(Sample sample, DispatchTable dispatchTable) throws SQLException {
        Bucket bucket = dispatchTable.route(sample.getSampleTime());
        insertInto(bucket.getName(), sample);
        return bucket;
    }
    
    private void insertInto(String tableName, Sample sample) throws SQLException {
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s)",
            ddl.qualify(schema, tableName), COLUMN_LIST, PLACEHOLDERS);
        
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, sample.getChannelId());
            stmt.setObject(2, sample.getSampleTime());
            stmt.setLong(3, sample.getNanosecs());
            stmt.setLong(4, sample.getSeverityId());
            stmt.setLong(5, sample.getStatusId());
            if (sample.getNumValue() != null) {
                stmt.setInt(6, sample.getNumValue());
            } else {
                stmt.setNull(6, Types.INTEGER);
            }
            if (sample.getFloatValue() != null) {
                stmt.setFloat(7, sample.getFloatValue());
            } else {
                stmt.setNull(7, Types.REAL);
            }
            stmt.setString(8, sample.getStringValue());
            stmt.setString(9, sample.getDatatype());
            stmt.setBytes(10, sample.getArrayValue());
            stmt.executeUpdate();
        }
    }
    
    /**
     * Rows stored in one table, including rows of tables inheriting from it.
     */
    public long countInTable(String tableName) throws SQLException {
        return count("SELECT COUNT(*) FROM " + ddl.qualify(schema, tableName));
    }
    
    /**
     * Rows stored in the parent table itself; zero while the insert hook is in place.
     */
    public long countInParentOnly() throws SQLException {
        return count("SELECT COUNT(*) FROM ONLY " + ddl.qualify(schema, SampleTableMetadata.TABLE_NAME));
    }
    
    private long count(String sql) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
