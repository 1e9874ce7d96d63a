package domain.output;

import domain.model.Tier;

import java.util.Locale;

/**
 * File naming policy for split statement files.
 * <p>
 * {@code <seq>_<table>.sql}, seq zero-padded to two digits so a plain directory listing
 * keeps the load order:
 * <pre>
 * 01_dim_country.sql
 * 02_fact_gdp.sql
 * 10_agg_country_year.sql
 * </pre>
 * The dataset/project prefix of the target is dropped.
 */
public final class SqlFileNamePolicy {

    private SqlFileNamePolicy() {
    }

    public static String build(int seq, String targetTable) {
        String name = safePart(Tier.lastSegment(targetTable).replace("`", ""), "unknownTable");
        name = limit(name, 120);
        return String.format(Locale.ROOT, "%02d_%s.sql", seq, name);
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // avoid hidden/odd files
        if (s.startsWith(".")) s = "_" + s.substring(1);
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
