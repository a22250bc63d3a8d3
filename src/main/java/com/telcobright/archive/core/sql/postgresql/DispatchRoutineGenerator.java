package com.telcobright.archive.core.sql.postgresql;

import com.telcobright.archive.core.metadata.SampleTableMetadata;
import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.routing.DispatchRoutine;
import com.telcobright.archive.core.routing.DispatchStrategy;
import com.telcobright.archive.core.routing.DispatchTable;

import java.util.List;

/**
 * Generates the PL/pgSQL trigger function that routes rows inserted into
 * the sample table to their bucket.
 *
 * The function always returns NULL so the row is never stored in the
 * parent, and raises when the timestamp matches no bucket.
 */
public class DispatchRoutineGenerator {

    private static final String ROW_TIME = "NEW." + SampleTableMetadata.TIME_COLUMN;
    private static final String INDENT = "    ";

    private final PostgreSQLDdlGenerator ddl;

    public DispatchRoutineGenerator(PostgreSQLDdlGenerator ddl) {
        this.ddl = ddl;
    }

    public DispatchRoutine generate(DispatchTable table, DispatchStrategy strategy) {
        String schema = table.getSchema();
        StringBuilder body = new StringBuilder();
        if (table.isEmpty()) {
            appendRaise(body, schema, 1);
        } else if (strategy == DispatchStrategy.LINEAR_NEWEST_FIRST) {
            appendLinear(body, schema, table.newestFirst());
        } else {
            appendBinary(body, schema, table.getBuckets(), 0, table.size(), 1);
        }

        StringBuilder sql = new StringBuilder();
        sql.append("CREATE OR REPLACE FUNCTION ")
           .append(ddl.qualify(schema, SampleTableMetadata.ROUTINE_NAME)).append("()\n");
        sql.append("RETURNS TRIGGER AS $dispatch$\n");
        sql.append("BEGIN\n");
        sql.append(body);
        sql.append(INDENT).append("RETURN NULL;\n");
        sql.append("END;\n");
        sql.append("$dispatch$ LANGUAGE plpgsql");
        return new DispatchRoutine(table, strategy, sql.toString());
    }

    private void appendLinear(StringBuilder body, String schema, List<Bucket> newestFirst) {
        for (int i = 0; i < newestFirst.size(); i++) {
            Bucket bucket = newestFirst.get(i);
            body.append(INDENT).append(i == 0 ? "IF " : "ELSIF ")
                .append(rangeTest(bucket)).append(" THEN\n");
            appendInsert(body, schema, bucket, 2);
        }
        body.append(INDENT).append("ELSE\n");
        appendRaise(body, schema, 2);
        body.append(INDENT).append("END IF;\n");
    }

    /**
     * Split [from, to) at the middle bucket's start until one bucket is left,
     * then test its full interval so gaps between buckets still raise.
     */
    private void appendBinary(StringBuilder body, String schema, List<Bucket> buckets,
                              int from, int to, int depth) {
        String indent = INDENT.repeat(depth);
        if (to - from == 1) {
            Bucket bucket = buckets.get(from);
            body.append(indent).append("IF ").append(rangeTest(bucket)).append(" THEN\n");
            appendInsert(body, schema, bucket, depth + 1);
            body.append(indent).append("ELSE\n");
            appendRaise(body, schema, depth + 1);
            body.append(indent).append("END IF;\n");
            return;
        }
        int middle = (from + to) >>> 1;
        body.append(indent).append("IF ").append(ROW_TIME).append(" < ")
            .append(ddl.timestampLiteral(buckets.get(middle).getStart())).append(" THEN\n");
        appendBinary(body, schema, buckets, from, middle, depth + 1);
        body.append(indent).append("ELSE\n");
        appendBinary(body, schema, buckets, middle, to, depth + 1);
        body.append(indent).append("END IF;\n");
    }

    private String rangeTest(Bucket bucket) {
        return "( " + ROW_TIME + " >= " + ddl.timestampLiteral(bucket.getStart())
            + " AND " + ROW_TIME + " < " + ddl.timestampLiteral(bucket.getEnd()) + " )";
    }

    private void appendInsert(StringBuilder body, String schema, Bucket bucket, int depth) {
        body.append(INDENT.repeat(depth))
            .append("INSERT INTO ").append(ddl.qualify(schema, bucket.getName()))
            .append(" VALUES (NEW.*);\n");
    }

    private void appendRaise(StringBuilder body, String schema, int depth) {
        // % is the RAISE placeholder, literal percent signs in the schema must be doubled
        String routine = (schema + "." + SampleTableMetadata.ROUTINE_NAME).replace("%", "%%");
        String message = "Error in " + routine + "(): smpl_time % out of range";
        body.append(INDENT.repeat(depth))
            .append("RAISE EXCEPTION ").append(ddl.escapeLiteral(message))
            .append(", ").append(ROW_TIME).append(";\n");
    }
}
