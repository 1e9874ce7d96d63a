package domain.model;

import java.util.List;

/**
 * Outcome of one generation run: the full script, its statements and the warnings.
 */
public final class GenerationResult {

    private final String sqlText;
    private final List<RenderedStatement> statements;
    private final List<GenerationWarning> warnings;
    private final GenerationSummary summary;

    public GenerationResult(String sqlText, List<RenderedStatement> statements, List<GenerationWarning> warnings) {
        this.sqlText = sqlText == null ? "" : sqlText;
        this.statements = List.copyOf(statements);
        this.warnings = List.copyOf(warnings);
        this.summary = GenerationSummary.from(this.statements, this.warnings);
    }

    public String getSqlText() {
        return sqlText;
    }

    public List<RenderedStatement> getStatements() {
        return statements;
    }

    public List<GenerationWarning> getWarnings() {
        return warnings;
    }

    public GenerationSummary getSummary() {
        return summary;
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.getCode() == code);
    }
}
