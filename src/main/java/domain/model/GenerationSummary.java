package domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured per-run summary for a calling orchestrator.
 *
 * <p>{@link #requiresReview()} is the single switch an orchestrator needs to decide whether
 * the script can run unattended.</p>
 */
public final class GenerationSummary {

    private final int renderedCount;
    private final List<String> missingSourceTargets;
    private final List<String> skippedTargets;
    private final boolean repairedInput;
    private final int warningCount;

    public GenerationSummary(
            int renderedCount,
            List<String> missingSourceTargets,
            List<String> skippedTargets,
            boolean repairedInput,
            int warningCount
    ) {
        this.renderedCount = renderedCount;
        this.missingSourceTargets = List.copyOf(missingSourceTargets);
        this.skippedTargets = List.copyOf(skippedTargets);
        this.repairedInput = repairedInput;
        this.warningCount = warningCount;
    }

    /** Derives the summary from the statements and warnings of one run. */
    public static GenerationSummary from(List<RenderedStatement> statements, List<GenerationWarning> warnings) {
        List<String> missing = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        boolean repaired = false;

        for (GenerationWarning w : warnings) {
            switch (w.getCode()) {
                case REPAIRED_INPUT -> repaired = true;
                case MISSING_SOURCE -> missing.add(w.getTargetTable());
                case UNKNOWN_TIER_SKIPPED, DUPLICATE_TARGET, PIVOT_GROUPING_EMPTY -> skipped.add(w.getTargetTable());
                default -> {
                }
            }
        }
        return new GenerationSummary(statements.size(), missing, skipped, repaired, warnings.size());
    }

    public int getRenderedCount() {
        return renderedCount;
    }

    public int getMissingSourceCount() {
        return missingSourceTargets.size();
    }

    public List<String> getMissingSourceTargets() {
        return missingSourceTargets;
    }

    public List<String> getSkippedTargets() {
        return skippedTargets;
    }

    public boolean isRepairedInput() {
        return repairedInput;
    }

    public int getWarningCount() {
        return warningCount;
    }

    public boolean requiresReview() {
        return repairedInput || !missingSourceTargets.isEmpty() || !skippedTargets.isEmpty();
    }

    @Override
    public String toString() {
        return "rendered=" + renderedCount
                + ", missingSource=" + missingSourceTargets
                + ", skipped=" + skippedTargets
                + ", repaired=" + repairedInput
                + ", warnings=" + warningCount;
    }
}
