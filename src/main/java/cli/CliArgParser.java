package cli;

import java.util.HashMap;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 *
 * <p>Every option may also come from a JVM system property of the same name
 * ({@code -Didempotent=true}); the command line wins.</p>
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /** Option value from argv, else from the system property {@code key}, else null. */
    public static String option(Map<String, String> argv, String key) {
        if (key == null) return null;
        if (argv != null && argv.containsKey(key)) return argv.get(key);
        return System.getProperty(key);
    }

    public static String option(Map<String, String> argv, String key, String def) {
        String v = option(argv, key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noResult       => true</li>
     *   <li>--noResult=true  => true</li>
     *   <li>--noResult=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (key == null) return false;
        boolean present = (argv != null && argv.containsKey(key)) || System.getProperty(key) != null;
        if (!present) return false;
        String raw = option(argv, key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
