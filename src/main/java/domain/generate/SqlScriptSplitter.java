package domain.generate;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a generated script back into statement blocks.
 *
 * <p>A block starts at a {@code -- [n]} header line and ends before the delimiter line.
 * Banner and blank lines outside blocks are dropped.</p>
 */
public final class SqlScriptSplitter {

    private SqlScriptSplitter() {
    }

    public static List<String> split(String script) {
        List<String> out = new ArrayList<>();
        if (script == null || script.isEmpty()) return out;

        StringBuilder cur = null;
        for (String line : script.split("\r?\n", -1)) {
            if (line.trim().equals(StatementRenderer.DELIMITER)) {
                if (cur != null) out.add(cur.toString().stripTrailing());
                cur = null;
                continue;
            }
            if (cur == null) {
                if (!line.startsWith("-- [")) continue;
                cur = new StringBuilder(512);
            }
            cur.append(line).append('\n');
        }
        // unterminated last block
        if (cur != null && !cur.toString().isBlank()) out.add(cur.toString().stripTrailing());
        return out;
    }
}
