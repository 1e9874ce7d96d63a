package domain.model;

/**
 * Standard warning codes for generation/reporting.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for whoever reviews the generated script.</p>
 */
public enum WarningCode {

    /**
     * Mapping JSON did not parse as-is and was repaired before generation.
     */
    REPAIRED_INPUT,

    /**
     * No source table is known for the target; a placeholder was rendered.
     */
    MISSING_SOURCE,

    /**
     * Target name matches none of dim_/fact_/agg_ and was not rendered.
     */
    UNKNOWN_TIER_SKIPPED,

    /**
     * Target name matches none of dim_/fact_/agg_ and was rendered after the agg_ tier.
     */
    UNKNOWN_TIER_RENDERED,

    /**
     * The same target table appears more than once; only the first mapping is used.
     */
    DUPLICATE_TARGET,

    /**
     * Pivot mapping has no grouping column; the statement is not rendered.
     */
    PIVOT_GROUPING_EMPTY,

    /**
     * MERGE was requested but the mapping has no primary key; INSERT was rendered instead.
     */
    PRIMARY_KEY_MISSING,

    /**
     * The upstream mapping producer attached an error/warning to the mapping.
     */
    UPSTREAM_MAPPING_ERROR
}
