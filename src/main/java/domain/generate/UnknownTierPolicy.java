package domain.generate;

import java.util.Locale;

/** What to do with a target whose name matches none of dim_/fact_/agg_. */
public enum UnknownTierPolicy {

    /** Skip it and report {@code UNKNOWN_TIER_SKIPPED}. */
    DROP,

    /** Render it after the agg_ tier and report {@code UNKNOWN_TIER_RENDERED}. */
    RENDER_LAST;

    /**
     * Accepts {@code drop}, {@code last}, {@code render}, {@code render_last} (any case).
     * Blank or unknown values fall back to {@link #DROP}.
     */
    public static UnknownTierPolicy parse(String raw) {
        if (raw == null || raw.isBlank()) return DROP;
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (v.equals("last") || v.equals("render") || v.equals("render_last")) return RENDER_LAST;
        return DROP;
    }
}
