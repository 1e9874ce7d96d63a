package domain.generate;

/**
 * Immutable generator settings.
 *
 * <p>Defaults reproduce the plain INSERT script of the World Bank warehouse load.</p>
 */
public final class GenerationOptions {

    public static final String DEFAULT_LITERAL = "Default";
    public static final String DEFAULT_UNION_ORIGIN_LITERAL = "World Bank Staging";
    public static final String DEFAULT_RATIO_NUMERATOR = "NY.GDP.MKTP.CD";
    public static final String DEFAULT_RATIO_DENOMINATOR = "SP.POP.TOTL";

    /** Placeholder in literal templates, replaced with the source table name (last segment). */
    public static final String SOURCE_PLACEHOLDER = "{source}";

    private final boolean idempotent;
    private final boolean repairEnabled;
    private final UnknownTierPolicy unknownTierPolicy;
    private final String defaultLiteral;
    private final String unionOriginLiteral;
    private final String ratioNumeratorCode;
    private final String ratioDenominatorCode;

    private GenerationOptions(Builder b) {
        this.idempotent = b.idempotent;
        this.repairEnabled = b.repairEnabled;
        this.unknownTierPolicy = b.unknownTierPolicy == null ? UnknownTierPolicy.DROP : b.unknownTierPolicy;
        this.defaultLiteral = orDefault(b.defaultLiteral, DEFAULT_LITERAL);
        this.unionOriginLiteral = orDefault(b.unionOriginLiteral, DEFAULT_UNION_ORIGIN_LITERAL);
        this.ratioNumeratorCode = orDefault(b.ratioNumeratorCode, DEFAULT_RATIO_NUMERATOR);
        this.ratioDenominatorCode = orDefault(b.ratioDenominatorCode, DEFAULT_RATIO_DENOMINATOR);
    }

    public static GenerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String orDefault(String v, String def) {
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    /** MERGE keyed on primary_key instead of plain INSERT. */
    public boolean isIdempotent() {
        return idempotent;
    }

    public boolean isRepairEnabled() {
        return repairEnabled;
    }

    public UnknownTierPolicy getUnknownTierPolicy() {
        return unknownTierPolicy;
    }

    /** String default for unmapped columns of a DIRECT load. */
    public String getDefaultLiteral() {
        return defaultLiteral;
    }

    /** String default for unmapped columns of each UNION branch. */
    public String getUnionOriginLiteral() {
        return unionOriginLiteral;
    }

    public String getRatioNumeratorCode() {
        return ratioNumeratorCode;
    }

    public String getRatioDenominatorCode() {
        return ratioDenominatorCode;
    }

    @Override
    public String toString() {
        return "idempotent=" + idempotent
                + ", repair=" + repairEnabled
                + ", unknownTier=" + unknownTierPolicy
                + ", defaultLiteral=" + defaultLiteral
                + ", unionLiteral=" + unionOriginLiteral
                + ", ratio=" + ratioNumeratorCode + "/" + ratioDenominatorCode;
    }

    public static final class Builder {
        private boolean idempotent;
        private boolean repairEnabled = true;
        private UnknownTierPolicy unknownTierPolicy = UnknownTierPolicy.DROP;
        private String defaultLiteral;
        private String unionOriginLiteral;
        private String ratioNumeratorCode;
        private String ratioDenominatorCode;

        private Builder() {
        }

        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Builder repairEnabled(boolean repairEnabled) {
            this.repairEnabled = repairEnabled;
            return this;
        }

        public Builder unknownTierPolicy(UnknownTierPolicy policy) {
            this.unknownTierPolicy = policy;
            return this;
        }

        public Builder defaultLiteral(String literal) {
            this.defaultLiteral = literal;
            return this;
        }

        public Builder unionOriginLiteral(String literal) {
            this.unionOriginLiteral = literal;
            return this;
        }

        public Builder ratioCodes(String numeratorCode, String denominatorCode) {
            this.ratioNumeratorCode = numeratorCode;
            this.ratioDenominatorCode = denominatorCode;
            return this;
        }

        public GenerationOptions build() {
            return new GenerationOptions(this);
        }
    }
}
