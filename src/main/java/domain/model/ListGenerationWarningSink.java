package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicates by (code|targetTable|message|detail) so that a warning raised once per
 * UNION branch or per column is reported once per target.</p>
 */
public final class ListGenerationWarningSink implements GenerationWarningSink {

    private final List<GenerationWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListGenerationWarningSink(List<GenerationWarning> target) {
        this.target = target;
    }

    private static String key(GenerationWarning w) {
        return w.getCode().name() + "|"
                + w.getTargetTable() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(GenerationWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
