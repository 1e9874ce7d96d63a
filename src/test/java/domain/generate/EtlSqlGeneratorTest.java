package domain.generate;

import domain.mapping.MalformedMappingException;
import domain.model.GenerationResult;
import domain.model.GenerationSummary;
import domain.model.RenderedStatement;
import domain.model.Strategy;
import domain.model.Tier;
import domain.model.WarningCode;
import infra.mapping.MappingJsonLoader;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EtlSqlGeneratorTest {

    private static final String COUNTRY_DIRECT = "{\"mapping\": {\"mappings\": [{"
            + "\"source_table\": \"staging.countries\","
            + "\"target_table\": \"target.dim_country\","
            + "\"column_mappings\": [{\"source_column\": \"country_code\", \"target_column\": \"country_key\"}]"
            + "}]}}";

    private static EtlSqlGenerator generator() {
        return new EtlSqlGenerator(new MappingJsonLoader());
    }

    private static EtlSqlGenerator generator(GenerationOptions options) {
        return new EtlSqlGenerator(new MappingJsonLoader(), options);
    }

    static String fixture(String name) {
        try (InputStream in = EtlSqlGeneratorTest.class.getResourceAsStream("/mapping/" + name)) {
            assertNotNull(in, "fixture not found: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static RenderedStatement statementFor(GenerationResult r, String target) {
        for (RenderedStatement s : r.getStatements()) {
            if (s.getTargetTable().equals(target)) return s;
        }
        return fail("no statement for " + target);
    }

    @Test
    void should_render_single_direct_insert_end_to_end() {
        GenerationResult r = generator().generate(COUNTRY_DIRECT);

        assertTrue(r.getSqlText().contains(
                "INSERT INTO `target.dim_country` (country_key)\n"
                        + "SELECT country_code AS country_key\n"
                        + "FROM `staging.countries`;"), r.getSqlText());
        assertTrue(r.getSqlText().contains("-- [1] DIM target.dim_country (DIRECT)"));
        assertTrue(r.getWarnings().isEmpty());
        assertFalse(r.getSummary().requiresReview());
    }

    @Test
    void should_produce_identical_text_for_identical_input() {
        String json = fixture("worldbank_mapping.json");

        String first = generator().generate(json).getSqlText();
        String second = generator().generate(json).getSqlText();

        assertEquals(first, second);
    }

    @Test
    void should_emit_dim_then_fact_then_agg_keeping_input_order_within_tier() {
        GenerationResult r = generator().generate(fixture("worldbank_mapping.json"));

        List<String> targets = new ArrayList<>();
        List<Tier> tiers = new ArrayList<>();
        for (RenderedStatement s : r.getStatements()) {
            targets.add(s.getTargetTable());
            tiers.add(s.getTier());
        }
        assertEquals(List.of(
                "warehouse.dim_country",
                "warehouse.dim_date",
                "warehouse.fact_indicator_value",
                "warehouse.agg_country_year"), targets);
        assertEquals(List.of(Tier.DIM, Tier.DIM, Tier.FACT, Tier.AGG), tiers);

        String sql = r.getSqlText();
        assertTrue(sql.indexOf("`warehouse.dim_country`") < sql.indexOf("`warehouse.fact_indicator_value` (")
                && sql.indexOf("`warehouse.fact_indicator_value` (") < sql.indexOf("`warehouse.agg_country_year`"));
    }

    @Test
    void should_select_each_source_column_as_target_in_mapping_order() {
        String json = "{\"mappings\": [{\"source_table\": \"s.src\", \"target_table\": \"t.dim_x\","
                + "\"column_mappings\": ["
                + "{\"source_column\": \"b\", \"target_column\": \"bb\"},"
                + "{\"source_column\": \"a\", \"target_column\": \"aa\"},"
                + "{\"source_column\": \"c\", \"target_column\": \"cc\"}]}]}";

        GenerationResult r = generator().generate(json);

        assertTrue(r.getSqlText().contains("INSERT INTO `t.dim_x` (bb, aa, cc)\n"
                + "SELECT b AS bb, a AS aa, c AS cc\n"
                + "FROM `s.src`;"), r.getSqlText());
    }

    @Test
    void should_fan_out_one_union_branch_per_source() {
        GenerationResult r = generator().generate(fixture("worldbank_mapping.json"));
        RenderedStatement fact = statementFor(r, "warehouse.fact_indicator_value");

        assertEquals(Strategy.UNION, fact.getStrategy());
        String sql = fact.getSqlText();
        assertEquals(1, count(sql, "UNION ALL"));
        assertTrue(sql.contains("FROM `staging.wb_indicators_2020`\nUNION ALL\nSELECT "), sql);
        assertTrue(sql.contains("FROM `staging.wb_indicators_2021`;"), sql);
        assertTrue(sql.contains("'World Bank Staging' AS origin_system"), sql);
        assertTrue(sql.contains("CURRENT_TIMESTAMP() AS loaded_at"), sql);
        assertTrue(sql.contains("UPPER(country_code) AS country_key"), sql);
    }

    @Test
    void should_substitute_source_name_into_union_literal_template() {
        GenerationOptions options = GenerationOptions.builder().unionOriginLiteral("{source}").build();
        RenderedStatement fact = statementFor(generator(options).generate(fixture("worldbank_mapping.json")),
                "warehouse.fact_indicator_value");

        assertTrue(fact.getSqlText().contains("'wb_indicators_2020' AS origin_system"), fact.getSqlText());
        assertTrue(fact.getSqlText().contains("'wb_indicators_2021' AS origin_system"), fact.getSqlText());
    }

    @Test
    void should_pivot_indicators_and_group_by_sorted_plain_columns() {
        GenerationResult r = generator().generate(fixture("worldbank_mapping.json"));
        RenderedStatement agg = statementFor(r, "warehouse.agg_country_year");

        assertEquals(Strategy.PIVOT, agg.getStrategy());
        String sql = agg.getSqlText();
        assertTrue(sql.contains("MAX(IF(indicator_code = 'NY.GDP.MKTP.CD', numeric_value, NULL)) AS gdp_usd"), sql);
        assertTrue(sql.contains("MAX(IF(indicator_code = 'SP.POP.TOTL', numeric_value, NULL)) AS population"), sql);
        assertTrue(sql.contains("SAFE_DIVIDE(MAX(IF(indicator_code = 'NY.GDP.MKTP.CD', numeric_value, NULL)), "
                + "MAX(IF(indicator_code = 'SP.POP.TOTL', numeric_value, NULL))) AS gdp_per_capita"), sql);
        assertTrue(sql.endsWith("FROM `warehouse.fact_indicator_value`\nGROUP BY country_key, year;"), sql);
    }

    @Test
    void should_keep_group_by_text_when_column_order_changes() {
        String a = "{\"mappings\": [{\"source_table\": \"w.fact_v\", \"target_table\": \"w.agg_v\","
                + "\"column_mappings\": ["
                + "{\"source_column\": \"year\", \"target_column\": \"year\"},"
                + "{\"source_column\": \"country_key\", \"target_column\": \"country_key\"}]}]}";
        String b = "{\"mappings\": [{\"source_table\": \"w.fact_v\", \"target_table\": \"w.agg_v\","
                + "\"column_mappings\": ["
                + "{\"source_column\": \"country_key\", \"target_column\": \"country_key\"},"
                + "{\"source_column\": \"year\", \"target_column\": \"year\"}]}]}";

        assertTrue(generator().generate(a).getSqlText().contains("GROUP BY country_key, year;"));
        assertTrue(generator().generate(b).getSqlText().contains("GROUP BY country_key, year;"));
    }

    @Test
    void should_skip_pivot_without_grouping_column() {
        String json = "{\"mappings\": [{\"source_table\": \"w.fact_v\", \"target_table\": \"w.agg_v\","
                + "\"column_mappings\": [{\"source_column\": \"numeric_value\", \"target_column\": \"gdp\","
                + "\"transformation\": \"numeric_value WHERE indicator_code = 'X'\"}]}]}";

        GenerationResult r = generator().generate(json);

        assertTrue(r.getStatements().isEmpty());
        assertTrue(r.hasWarning(WarningCode.PIVOT_GROUPING_EMPTY));
        assertEquals(List.of("w.agg_v"), r.getSummary().getSkippedTargets());
    }

    @Test
    void should_emit_commented_placeholder_for_missing_source() {
        GenerationResult r = generator().generate(fixture("worldbank_mapping.json"));
        RenderedStatement dimDate = statementFor(r, "warehouse.dim_date");

        assertEquals(Strategy.MISSING_SOURCE, dimDate.getStrategy());
        String sql = dimDate.getSqlText();
        assertTrue(sql.contains("-- WARNING: No source table found for target 'warehouse.dim_date'."), sql);
        assertTrue(sql.contains("-- INSERT INTO `warehouse.dim_date` (date_key, year)"), sql);
        for (String line : sql.split("\n")) {
            assertTrue(line.startsWith("--"), "uncommented line: " + line);
        }

        GenerationSummary s = r.getSummary();
        assertEquals(1, s.getMissingSourceCount());
        assertEquals(List.of("warehouse.dim_date"), s.getMissingSourceTargets());
        assertTrue(s.requiresReview());
    }

    @Test
    void should_annotate_upstream_mapping_errors() {
        GenerationResult r = generator().generate(fixture("worldbank_mapping.json"));
        RenderedStatement dimDate = statementFor(r, "warehouse.dim_date");

        assertTrue(dimDate.getSqlText().contains(
                "-- NOTE: upstream mapping error [NO_SOURCE/HIGH] no staging table carries calendar data"));
        assertTrue(r.hasWarning(WarningCode.UPSTREAM_MAPPING_ERROR));
        assertEquals(2, dimDate.getWarnings().size());
    }

    @Test
    void should_repair_truncated_input_once_and_flag_it() {
        GenerationResult r = generator().generate(fixture("truncated_mapping.json"));

        assertTrue(r.hasWarning(WarningCode.REPAIRED_INPUT));
        assertTrue(r.getSummary().isRepairedInput());
        assertTrue(r.getSummary().requiresReview());
        assertTrue(r.getSqlText().contains("-- WARNING: input mapping JSON was malformed and has been repaired"));
        assertEquals(1, r.getStatements().size());
    }

    @Test
    void should_repair_missing_trailing_brace() {
        String truncated = COUNTRY_DIRECT.substring(0, COUNTRY_DIRECT.length() - 1);

        GenerationResult r = generator().generate(truncated);

        assertTrue(r.hasWarning(WarningCode.REPAIRED_INPUT));
        assertTrue(r.getSqlText().contains("SELECT country_code AS country_key"));
    }

    @Test
    void should_not_repair_two_unrelated_defects() {
        String broken = COUNTRY_DIRECT
                .replace("\"target.dim_country\",", "\"target.dim_country\"")
                .substring(0, COUNTRY_DIRECT.length() - 2);

        assertThrows(MalformedMappingException.class, () -> generator().generate(broken));
    }

    @Test
    void should_fail_when_repair_is_disabled() {
        GenerationOptions options = GenerationOptions.builder().repairEnabled(false).build();

        assertThrows(MalformedMappingException.class,
                () -> generator(options).generate(fixture("truncated_mapping.json")));
    }

    @Test
    void should_fail_when_input_stays_unparseable_after_repair() {
        assertThrows(MalformedMappingException.class,
                () -> generator().generate("{\"mappings\": [{\"target_table\": \"t.dim_x\", \"colu"));
        assertThrows(MalformedMappingException.class, () -> generator().generate("not json"));
    }

    @Test
    void should_render_merge_keyed_on_primary_key_when_idempotent() {
        GenerationOptions options = GenerationOptions.builder().idempotent(true).build();
        RenderedStatement dim = statementFor(generator(options).generate(fixture("worldbank_mapping.json")),
                "warehouse.dim_country");

        assertEquals("-- [1] DIM warehouse.dim_country (DIRECT)\n"
                + "-- Populating 'warehouse.dim_country' from 'staging.countries' (idempotent MERGE on country_key)\n"
                + "MERGE `warehouse.dim_country` AS T\n"
                + "USING (\n"
                + "  SELECT S.country_code AS country_key, TRIM(S.country_name) AS country_name, S.region AS region\n"
                + "  FROM `staging.countries` AS S\n"
                + ") AS S\n"
                + "ON T.country_key = S.country_key\n"
                + "WHEN MATCHED THEN UPDATE SET T.country_key = S.country_key, T.country_name = S.country_name, "
                + "T.region = S.region\n"
                + "WHEN NOT MATCHED THEN INSERT (country_key, country_name, region) "
                + "VALUES (S.country_key, S.country_name, S.region);", dim.getSqlText());
    }

    @Test
    void should_alias_every_union_branch_inside_merge_source() {
        GenerationOptions options = GenerationOptions.builder().idempotent(true).build();
        String json = "{\"mappings\": [{\"source_table\": \"s.a, s.b\", \"target_table\": \"w.fact_v\","
                + "\"primary_key\": [\"k\"],"
                + "\"column_mappings\": ["
                + "{\"source_column\": \"k\", \"target_column\": \"k\", \"transformation\": \"UPPER(k)\"},"
                + "{\"source_column\": \"v\", \"target_column\": \"v\"}]}]}";

        RenderedStatement fact = statementFor(generator(options).generate(json), "w.fact_v");

        assertEquals("-- [1] FACT w.fact_v (UNION)\n"
                + "-- Populating 'w.fact_v' by UNIONing 2 sources (idempotent MERGE on k)\n"
                + "MERGE `w.fact_v` AS T\n"
                + "USING (\n"
                + "  SELECT UPPER(S.k) AS k, S.v AS v\n"
                + "  FROM `s.a` AS S\n"
                + "  UNION ALL\n"
                + "  SELECT UPPER(S.k) AS k, S.v AS v\n"
                + "  FROM `s.b` AS S\n"
                + ") AS S\n"
                + "ON T.k = S.k\n"
                + "WHEN MATCHED THEN UPDATE SET T.k = S.k, T.v = S.v\n"
                + "WHEN NOT MATCHED THEN INSERT (k, v) VALUES (S.k, S.v);", fact.getSqlText());
    }

    @Test
    void should_keep_pivot_merge_source_unaliased_and_grouped() {
        GenerationOptions options = GenerationOptions.builder().idempotent(true).build();
        String json = "{\"mappings\": [{\"source_table\": \"w.fact_v\", \"target_table\": \"w.agg_v\","
                + "\"primary_key\": [\"country_key\"],"
                + "\"column_mappings\": ["
                + "{\"source_column\": \"country_key\", \"target_column\": \"country_key\"},"
                + "{\"source_column\": \"numeric_value\", \"target_column\": \"gdp\","
                + "\"transformation\": \"numeric_value WHERE indicator_code = 'NY.GDP.MKTP.CD'\"}]}]}";

        RenderedStatement agg = statementFor(generator(options).generate(json), "w.agg_v");

        assertEquals("-- [1] AGG w.agg_v (PIVOT)\n"
                + "-- Populating 'w.agg_v' by PIVOTING from 'w.fact_v' (idempotent MERGE on country_key)\n"
                + "MERGE `w.agg_v` AS T\n"
                + "USING (\n"
                + "  SELECT country_key AS country_key, "
                + "MAX(IF(indicator_code = 'NY.GDP.MKTP.CD', numeric_value, NULL)) AS gdp\n"
                + "  FROM `w.fact_v`\n"
                + "  GROUP BY country_key\n"
                + ") AS S\n"
                + "ON T.country_key = S.country_key\n"
                + "WHEN MATCHED THEN UPDATE SET T.country_key = S.country_key, T.gdp = S.gdp\n"
                + "WHEN NOT MATCHED THEN INSERT (country_key, gdp) VALUES (S.country_key, S.gdp);", agg.getSqlText());
    }

    @Test
    void should_fall_back_to_insert_when_primary_key_missing() {
        GenerationOptions options = GenerationOptions.builder().idempotent(true).build();
        GenerationResult r = generator(options).generate(COUNTRY_DIRECT);

        assertTrue(r.hasWarning(WarningCode.PRIMARY_KEY_MISSING));
        assertTrue(r.getSqlText().contains("INSERT INTO `target.dim_country` (country_key)"));
        assertFalse(r.getSqlText().contains("MERGE `"));
    }

    @Test
    void should_honor_explicit_strategy_over_name_heuristics() {
        String json = "{\"mappings\": [{\"source_table\": \"w.fact_v\", \"target_table\": \"w.agg_flat\","
                + "\"strategy\": \"direct\","
                + "\"column_mappings\": [{\"source_column\": \"a\", \"target_column\": \"a\"}]}]}";

        GenerationResult r = generator().generate(json);

        assertEquals(Strategy.DIRECT, r.getStatements().get(0).getStrategy());
        assertFalse(r.getSqlText().contains("GROUP BY"));
    }

    @Test
    void should_use_derived_metric_operands_for_ratio() {
        String json = "{\"mappings\": [{\"source_table\": \"w.fact_v\", \"target_table\": \"w.agg_v\","
                + "\"column_mappings\": ["
                + "{\"source_column\": \"country_key\", \"target_column\": \"country_key\"},"
                + "{\"source_column\": \"UNMAPPED\", \"target_column\": \"co2_per_capita\","
                + "\"derived_metric\": {\"numerator_code\": \"EN.ATM.CO2E.KT\", \"denominator_code\": \"SP.POP.TOTL\"}}"
                + "]}]}";

        String sql = generator().generate(json).getSqlText();

        assertTrue(sql.contains("SAFE_DIVIDE(MAX(IF(indicator_code = 'EN.ATM.CO2E.KT', numeric_value, NULL)), "
                + "MAX(IF(indicator_code = 'SP.POP.TOTL', numeric_value, NULL))) AS co2_per_capita"), sql);
    }

    @Test
    void should_drop_unknown_tier_by_default_and_render_last_on_request() {
        String json = "{\"mappings\": ["
                + "{\"source_table\": \"s.a\", \"target_table\": \"w.lookup_codes\","
                + "\"column_mappings\": [{\"source_column\": \"a\", \"target_column\": \"a\"}]},"
                + "{\"source_table\": \"s.b\", \"target_table\": \"w.dim_b\","
                + "\"column_mappings\": [{\"source_column\": \"b\", \"target_column\": \"b\"}]}]}";

        GenerationResult dropped = generator().generate(json);
        assertEquals(1, dropped.getStatements().size());
        assertTrue(dropped.hasWarning(WarningCode.UNKNOWN_TIER_SKIPPED));
        assertEquals(List.of("w.lookup_codes"), dropped.getSummary().getSkippedTargets());

        GenerationOptions options = GenerationOptions.builder().unknownTierPolicy(UnknownTierPolicy.RENDER_LAST).build();
        GenerationResult rendered = generator(options).generate(json);
        assertEquals(2, rendered.getStatements().size());
        assertEquals("w.lookup_codes", rendered.getStatements().get(1).getTargetTable());
        assertEquals(Tier.OTHER, rendered.getStatements().get(1).getTier());
        assertTrue(rendered.hasWarning(WarningCode.UNKNOWN_TIER_RENDERED));
    }

    @Test
    void should_keep_first_of_duplicate_targets() {
        String json = "{\"mappings\": ["
                + "{\"source_table\": \"s.first\", \"target_table\": \"w.dim_x\","
                + "\"column_mappings\": [{\"source_column\": \"a\", \"target_column\": \"a\"}]},"
                + "{\"source_table\": \"s.second\", \"target_table\": \"w.dim_x\","
                + "\"column_mappings\": [{\"source_column\": \"a\", \"target_column\": \"a\"}]}]}";

        GenerationResult r = generator().generate(json);

        assertEquals(1, r.getStatements().size());
        assertTrue(r.getSqlText().contains("FROM `s.first`;"));
        assertFalse(r.getSqlText().contains("s.second`;"));
        assertTrue(r.hasWarning(WarningCode.DUPLICATE_TARGET));
    }

    @Test
    void should_produce_banner_only_for_empty_document() {
        GenerationResult r = generator().generate("{\"mappings\": []}");

        assertTrue(r.getStatements().isEmpty());
        assertTrue(r.getSqlText().startsWith(EtlSqlGeneratorEngine.BANNER_RULE));
        assertFalse(r.getSqlText().contains(StatementRenderer.DELIMITER));
    }

    @Test
    void should_split_generated_script_into_one_block_per_statement() {
        GenerationResult r = generator().generate(fixture("worldbank_mapping.json"));

        List<String> blocks = SqlScriptSplitter.split(r.getSqlText());

        assertEquals(r.getStatements().size(), blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            assertEquals(r.getStatements().get(i).getSqlText(), blocks.get(i));
        }
    }

    private static int count(String s, String needle) {
        int n = 0;
        int i = s.indexOf(needle);
        while (i >= 0) {
            n++;
            i = s.indexOf(needle, i + needle.length());
        }
        return n;
    }
}
