package com.telcobright.archive.core.sql.postgresql;

import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.Granularity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PostgreSQLDdlGenerator Tests")
class PostgreSQLDdlGeneratorTest {

    private PostgreSQLDdlGenerator generator;
    private Bucket week;

    @BeforeEach
    void setUp() {
        generator = new PostgreSQLDdlGenerator();
        week = Bucket.containing(LocalDateTime.of(2012, 6, 1, 0, 0), Granularity.WEEK);
    }

    @Test
    @DisplayName("Should create the parent table with every sample column")
    void testCreateParentTable() {
        String sql = generator.generateCreateParentTable("archive");

        assertThat(sql).startsWith("CREATE TABLE IF NOT EXISTS \"archive\".\"sample\" (")
            .contains("channel_id BIGINT NOT NULL")
            .contains("smpl_time TIMESTAMP NOT NULL")
            .contains("str_val VARCHAR(120) NULL")
            .contains("datatype CHAR(1) NULL DEFAULT ' '")
            .contains("array_val BYTEA NULL");
    }

    @Test
    @DisplayName("Should bound the bucket with a half-open CHECK constraint")
    void testCreateBucketTable() {
        assertThat(generator.generateCreateBucketTable("archive", week)).isEqualTo(
            "CREATE TABLE \"archive\".\"sample_w2012w22\" (CONSTRAINT \"sample_w2012w22_smpl_time_check\" "
                + "CHECK (smpl_time >= TIMESTAMP '2012-05-28 00:00:00' AND smpl_time < TIMESTAMP '2012-06-04 00:00:00')) "
                + "INHERITS (\"archive\".\"sample\")");
    }

    @Test
    @DisplayName("Should emit bucket statements in creation order")
    void testBucketStatementOrder() {
        List<String> statements = generator.generateBucketStatements("archive", "table_owner", week);

        assertThat(statements).hasSize(6);
        assertThat(statements.get(0)).startsWith("CREATE TABLE \"archive\".\"sample_w2012w22\"");
        assertThat(statements.get(1)).isEqualTo("ALTER TABLE \"archive\".\"sample_w2012w22\" OWNER TO \"table_owner\"");
        assertThat(statements.get(2)).isEqualTo(
            "CREATE INDEX \"sample_w2012w22_channel_time_idx\" ON \"archive\".\"sample_w2012w22\" "
                + "(\"channel_id\", \"smpl_time\", \"nanosecs\")");
        assertThat(statements.get(3)).isEqualTo(
            "ALTER TABLE \"archive\".\"sample_w2012w22\" ADD CONSTRAINT \"sample_w2012w22_channel_id_fkey\" "
                + "FOREIGN KEY (\"channel_id\") REFERENCES \"archive\".\"channel\"(\"channel_id\") ON DELETE CASCADE");
        assertThat(statements.get(4)).contains("REFERENCES \"archive\".\"severity\"(\"severity_id\")");
        assertThat(statements.get(5)).contains("REFERENCES \"archive\".\"status\"(\"status_id\")");
    }

    @Test
    @DisplayName("Should attach the trigger before insert on the parent")
    void testCreateTrigger() {
        assertThat(generator.generateCreateTrigger("archive")).isEqualTo(
            "CREATE TRIGGER \"sample_insert_trigger\" BEFORE INSERT ON \"archive\".\"sample\" "
                + "FOR EACH ROW EXECUTE PROCEDURE \"archive\".\"sample_insert_trigger_function\"()");
    }

    @Test
    @DisplayName("Should escape quotes in identifiers and literals")
    void testEscaping() {
        assertThat(generator.qualify("my\"schema", "sample")).isEqualTo("\"my\"\"schema\".\"sample\"");
        assertThat(generator.generateAlterOwner("archive", "sample_y2012", "o'brien\""))
            .endsWith("OWNER TO \"o'brien\"\"\"");
        assertThat(generator.generateCommentOnRoutine("archive", "it's"))
            .isEqualTo("COMMENT ON FUNCTION \"archive\".\"sample_insert_trigger_function\"() IS 'it''s'");
    }
}
