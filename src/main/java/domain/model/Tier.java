package domain.model;

/**
 * Load tier derived from the target table name prefix.
 *
 * <p>Declaration order is emission order: agg_ tables read from fact_ tables,
 * which reference dim_ tables.</p>
 */
public enum Tier {
    DIM("dim_"),
    FACT("fact_"),
    AGG("agg_"),
    OTHER("");

    private final String prefix;

    Tier(String prefix) {
        this.prefix = prefix;
    }

    /** Classifies by the final '.'-separated segment of a qualified table name. */
    public static Tier of(String targetTable) {
        String name = lastSegment(targetTable);
        for (Tier t : values()) {
            if (t != OTHER && name.startsWith(t.prefix)) return t;
        }
        return OTHER;
    }

    public static String lastSegment(String qualifiedName) {
        if (qualifiedName == null) return "";
        String s = qualifiedName.trim();
        int p = s.lastIndexOf('.');
        return p >= 0 ? s.substring(p + 1) : s;
    }
}
