package domain.mapping;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * One-shot repair of truncated mapping JSON (typically a model response cut off mid-document).
 *
 * <p>Steps, applied once and in order:
 * <ol>
 *   <li>drop the last line when it looks dangling: nothing but an optional <code>[</code>,
 *       <code>{</code> and <code>,</code>, or none of <code>: ] }</code></li>
 *   <li>strip one trailing comma</li>
 *   <li>close every still-open <code>{</code> / <code>[</code> in nesting order</li>
 * </ol>
 * The caller parses the result exactly once more; there is no loop.</p>
 */
public final class MappingJsonRepairer {

    private static final Pattern DANGLING_LINE = Pattern.compile("^\\[?\\{?,?$");
    private static final Pattern STRUCTURAL_CHAR = Pattern.compile("[:\\]}]");

    private MappingJsonRepairer() {
    }

    public static String repair(String raw) {
        if (raw == null) return "";
        String s = raw.strip();

        int lastNewline = s.lastIndexOf('\n');
        if (lastNewline != -1) {
            String lastLine = s.substring(lastNewline).strip();
            if (DANGLING_LINE.matcher(lastLine).matches() || !STRUCTURAL_CHAR.matcher(lastLine).find()) {
                s = s.substring(0, lastNewline).stripTrailing();
            }
        }

        if (s.endsWith(",")) {
            s = s.substring(0, s.length() - 1);
        }

        return s + missingClosers(s);
    }

    /**
     * Closers for the brackets left open at the end of {@code s}, innermost first.
     * Brackets inside string literals are ignored.
     */
    static String missingClosers(String s) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }
            switch (ch) {
                case '"' -> inString = true;
                case '{' -> open.push('}');
                case '[' -> open.push(']');
                case '}', ']' -> {
                    if (!open.isEmpty()) open.pop();
                }
                default -> {
                }
            }
        }

        StringBuilder sb = new StringBuilder(open.size());
        while (!open.isEmpty()) sb.append(open.pop());
        return sb.toString();
    }
}
