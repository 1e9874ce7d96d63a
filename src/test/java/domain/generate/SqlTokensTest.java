package domain.generate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlTokensTest {

    @Test
    void should_detect_where_as_whole_word_in_any_case() {
        assertTrue(SqlTokens.hasWhere("numeric_value WHERE indicator_code = 'X'"));
        assertTrue(SqlTokens.hasWhere("value where code = 'X'"));
        assertFalse(SqlTokens.hasWhere("COALESCE(somewhere_col, 0)"));
        assertFalse(SqlTokens.hasWhere(null));
    }

    @Test
    void should_return_first_quoted_literal() {
        assertEquals("NY.GDP.MKTP.CD", SqlTokens.firstQuotedLiteral("v WHERE c = 'NY.GDP.MKTP.CD' OR c = 'B'"));
        assertNull(SqlTokens.firstQuotedLiteral("v WHERE c = 'open"));
        assertNull(SqlTokens.firstQuotedLiteral("no literal"));
    }

    @Test
    void should_read_default_directive() {
        assertTrue(SqlTokens.isDefaultDirective("DEFAULT: CURRENT_DATE()"));
        assertTrue(SqlTokens.isDefaultDirective("default:0"));
        assertEquals("CURRENT_DATE()", SqlTokens.defaultDirectiveExpression("DEFAULT: CURRENT_DATE()"));
        assertFalse(SqlTokens.isDefaultDirective("IFNULL(a, 0)"));
    }

    @Test
    void should_escape_string_literal_for_bigquery() {
        assertEquals("'O\\'Brien'", SqlTokens.stringLiteral("O'Brien"));
        assertEquals("'a\\\\b'", SqlTokens.stringLiteral("a\\b"));
    }

    @Test
    void should_not_double_back_quotes_in_table_ref() {
        assertEquals("`proj.ds.t`", SqlTokens.tableRef("`proj.ds.t`"));
        assertEquals("`ds.t`", SqlTokens.tableRef(" ds.t "));
    }

    @Test
    void should_qualify_only_bare_occurrences_of_column() {
        assertEquals("UPPER(S.code)", SqlTokens.qualifyBareColumn("UPPER(code)", "code", "S"));
        assertEquals("S.code || 'code'", SqlTokens.qualifyBareColumn("code || 'code'", "code", "S"));
        assertEquals("x.code + S.code", SqlTokens.qualifyBareColumn("x.code + code", "code", "S"));
        assertEquals("code_name", SqlTokens.qualifyBareColumn("code_name", "code", "S"));
        assertEquals("`code`", SqlTokens.qualifyBareColumn("`code`", "code", "S"));
        assertEquals("CAST(S.value AS FLOAT64)", SqlTokens.qualifyBareColumn("CAST(value AS FLOAT64)", "value", "S"));
    }

    @Test
    void should_not_qualify_function_name_matching_column() {
        assertEquals("year(S.year)", SqlTokens.qualifyBareColumn("year(year)", "year", "S"));
    }
}
