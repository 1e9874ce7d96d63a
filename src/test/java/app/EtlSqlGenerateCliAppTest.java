package app;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EtlSqlGenerateCliAppTest {

    private static final String CLEAN = "{\"mappings\": [{\"source_table\": \"s.countries\","
            + "\"target_table\": \"w.dim_country\","
            + "\"column_mappings\": [{\"source_column\": \"code\", \"target_column\": \"country_key\"}]}]}";

    private static final String MISSING_SOURCE = "{\"mappings\": [{\"source_table\": \"NO_MATCHING_SOURCE_TABLES\","
            + "\"target_table\": \"w.dim_date\","
            + "\"column_mappings\": [{\"source_column\": \"UNMAPPED\", \"target_column\": \"date_key\"}]}]}";

    @TempDir
    Path tempDir;

    @AfterEach
    void clearBaseDir() {
        System.clearProperty("baseDir");
    }

    private Path write(String name, String text) throws Exception {
        Path p = tempDir.resolve(name);
        Files.writeString(p, text, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void should_write_script_split_files_and_report() throws Exception {
        write("mapping.json", CLEAN);

        int code = EtlSqlGenerateCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--mapping=mapping.json", "--splitDir=out/statements"});

        assertEquals(EtlSqlGenerateCliApp.EXIT_OK, code);
        Path script = tempDir.resolve("output").resolve("etl.sql");
        assertTrue(Files.readString(script).contains("INSERT INTO `w.dim_country` (country_key)"));
        assertTrue(Files.exists(tempDir.resolve("out").resolve("statements").resolve("01_dim_country.sql")));
        assertTrue(Files.exists(tempDir.resolve("output").resolve("etl-result.xlsx")));
    }

    @Test
    void should_read_csv_mapping_sheet_by_extension() throws Exception {
        write("mapping.csv", "source_table,target_table,source_column,target_column\n"
                + "s.countries,w.dim_country,code,country_key\n");
        Path out = tempDir.resolve("csv.sql");

        int code = EtlSqlGenerateCliApp.run(new String[]{
                "--mapping=" + tempDir.resolve("mapping.csv"), "--out=" + out, "--noResult"});

        assertEquals(EtlSqlGenerateCliApp.EXIT_OK, code);
        assertTrue(Files.readString(out).contains("SELECT code AS country_key"));
    }

    @Test
    void should_exit_with_failure_on_malformed_or_missing_input() throws Exception {
        Path bad = write("bad.json", "not json");

        assertEquals(EtlSqlGenerateCliApp.EXIT_FAILED, EtlSqlGenerateCliApp.run(new String[]{
                "--mapping=" + bad, "--noSqlOut", "--noResult"}));
        assertEquals(EtlSqlGenerateCliApp.EXIT_FAILED, EtlSqlGenerateCliApp.run(new String[]{
                "--mapping=" + tempDir.resolve("absent.json"), "--noSqlOut", "--noResult"}));
    }

    @Test
    void should_exit_with_review_code_only_when_requested() throws Exception {
        Path mapping = write("missing.json", MISSING_SOURCE);
        Path out = tempDir.resolve("review.sql");

        assertEquals(EtlSqlGenerateCliApp.EXIT_OK, EtlSqlGenerateCliApp.run(new String[]{
                "--mapping=" + mapping, "--out=" + out, "--noResult"}));
        assertEquals(EtlSqlGenerateCliApp.EXIT_REVIEW_REQUIRED, EtlSqlGenerateCliApp.run(new String[]{
                "--mapping=" + mapping, "--out=" + out, "--noResult", "--failOnReview"}));
        assertTrue(Files.readString(out).contains("-- WARNING: No source table found for target 'w.dim_date'."));
    }

    @Test
    void should_skip_outputs_when_toggled_off() throws Exception {
        write("mapping.json", CLEAN);

        int code = EtlSqlGenerateCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--mapping=mapping.json", "--noSqlOut", "--noResult"});

        assertEquals(EtlSqlGenerateCliApp.EXIT_OK, code);
        assertFalse(Files.exists(tempDir.resolve("output")));
    }
}
