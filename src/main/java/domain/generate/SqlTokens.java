package domain.generate;

import java.util.regex.Pattern;

/**
 * Small SQL text helpers shared by the synthesizer and the renderer.
 */
final class SqlTokens {

    private static final Pattern WHERE_WORD = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);
    private static final String DEFAULT_DIRECTIVE = "DEFAULT:";

    private SqlTokens() {
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /** Transformation text that carries an indicator filter, e.g. {@code value WHERE indicator_code = 'X'}. */
    static boolean hasWhere(String transformation) {
        return transformation != null && WHERE_WORD.matcher(transformation).find();
    }

    /** Content of the first single-quoted literal, or null when there is none. */
    static String firstQuotedLiteral(String text) {
        if (text == null) return null;
        int st = text.indexOf('\'');
        if (st < 0) return null;
        int ed = text.indexOf('\'', st + 1);
        if (ed < 0) return null;
        return text.substring(st + 1, ed);
    }

    /** {@code DEFAULT: <expr>} as written by the mapping producer for source-less columns. */
    static boolean isDefaultDirective(String transformation) {
        return transformation != null
                && transformation.regionMatches(true, 0, DEFAULT_DIRECTIVE, 0, DEFAULT_DIRECTIVE.length());
    }

    static String defaultDirectiveExpression(String transformation) {
        return transformation.substring(DEFAULT_DIRECTIVE.length()).trim();
    }

    /** Single-quoted SQL string literal (BigQuery escaping). */
    static String stringLiteral(String value) {
        String v = value == null ? "" : value;
        return "'" + v.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /** Back-quoted table reference; existing back quotes are not doubled. */
    static String tableRef(String qualifiedName) {
        String t = qualifiedName == null ? "" : qualifiedName.trim().replace("`", "");
        return "`" + t + "`";
    }

    /** Single-line text for use inside a {@code --} comment. */
    static String commentText(String s) {
        if (s == null) return "";
        return s.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').trim();
    }

    static boolean isPlainIdentifier(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!isWordChar(s.charAt(i))) return false;
        }
        return true;
    }

    /**
     * Prefix bare occurrences of {@code column} in {@code expression} with {@code alias.}.
     *
     * <p>A bare occurrence is a whole word (case-insensitive) that is not already qualified,
     * not back-quoted and not inside a quoted literal.</p>
     */
    static String qualifyBareColumn(String expression, String column, String alias) {
        if (expression == null || !isPlainIdentifier(column) || alias == null || alias.isEmpty()) {
            return expression;
        }

        StringBuilder out = new StringBuilder(expression.length() + 8);
        int n = column.length();
        int i = 0;
        while (i < expression.length()) {
            char ch = expression.charAt(i);

            if (ch == '\'' || ch == '"' || ch == '`') {
                int end = closingQuote(expression, i);
                out.append(expression, i, end);
                i = end;
                continue;
            }

            if (expression.regionMatches(true, i, column, 0, n)
                    && (i == 0 || isBareBoundary(expression.charAt(i - 1)))
                    && (i + n >= expression.length() || !isWordChar(expression.charAt(i + n)))
                    && (i + n >= expression.length() || expression.charAt(i + n) != '(')) {
                out.append(alias).append('.').append(expression, i, i + n);
                i += n;
                continue;
            }

            out.append(ch);
            i++;
        }
        return out.toString();
    }

    private static boolean isBareBoundary(char prev) {
        return !isWordChar(prev) && prev != '.';
    }

    /** Index just past the literal that opens at {@code start}; end of text when unterminated. */
    private static int closingQuote(String s, int start) {
        char q = s.charAt(start);
        int i = start + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == q) return i + 1;
            i++;
        }
        return s.length();
    }
}
