package domain.model;

import java.util.List;

/**
 * One generated DML statement, including its leading comment lines.
 *
 * <p>Simple value object; produced once per target table and never mutated.</p>
 */
public final class RenderedStatement {

    private final int seq;
    private final String targetTable;
    private final Tier tier;
    private final Strategy strategy;
    private final String sqlText;
    private final List<GenerationWarning> warnings;

    public RenderedStatement(
            int seq,
            String targetTable,
            Tier tier,
            Strategy strategy,
            String sqlText,
            List<GenerationWarning> warnings
    ) {
        this.seq = seq;
        this.targetTable = targetTable == null ? "" : targetTable;
        this.tier = tier;
        this.strategy = strategy;
        this.sqlText = sqlText == null ? "" : sqlText;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int getSeq() {
        return seq;
    }

    public String getTargetTable() {
        return targetTable;
    }

    public Tier getTier() {
        return tier;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public String getSqlText() {
        return sqlText;
    }

    public List<GenerationWarning> getWarnings() {
        return warnings;
    }
}
