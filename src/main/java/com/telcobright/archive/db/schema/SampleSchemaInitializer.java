package com.telcobright.archive.db.schema;

import com.telcobright.archive.core.metadata.SampleTableMetadata;
import com.telcobright.archive.core.sql.postgresql.PostgreSQLDdlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the parent sample table when it is missing. Never drops or
 * alters an existing one; lookup tables are owned elsewhere.
 */
public class SampleSchemaInitializer {

    private static final Logger logger = LoggerFactory.getLogger(SampleSchemaInitializer.class);

    private final DataSource dataSource;
    private final PostgreSQLDdlGenerator ddl;

    public SampleSchemaInitializer(DataSource dataSource, PostgreSQLDdlGenerator ddl) {
        this.dataSource = dataSource;
        this.ddl = ddl;
    }

    public void ensureParentTable(String schema) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(ddl.generateCreateParentTable(schema));
            logger.info("Ensured parent table {}.{}", schema, SampleTableMetadata.TABLE_NAME);
        }
    }
}
