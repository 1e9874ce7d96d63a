package domain.generate;

import domain.mapping.TableMapping;
import domain.model.GenerationWarning;
import domain.model.GenerationWarningSink;
import domain.model.Tier;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stable bucket sort of table mappings into dim_ → fact_ → agg_ (→ other) order.
 *
 * <p>This is a static name classification, not a dependency graph: it assumes the prefixes
 * never form cross-tier cycles.</p>
 */
final class TierOrderer {

    private final UnknownTierPolicy unknownTierPolicy;

    TierOrderer(UnknownTierPolicy unknownTierPolicy) {
        this.unknownTierPolicy = unknownTierPolicy == null ? UnknownTierPolicy.DROP : unknownTierPolicy;
    }

    List<TableMapping> order(List<TableMapping> mappings, GenerationWarningSink sink) {
        Map<Tier, List<TableMapping>> buckets = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) buckets.put(t, new ArrayList<>());

        Set<String> seenTargets = new HashSet<>();
        for (TableMapping m : mappings) {
            if (!seenTargets.add(m.targetTable)) {
                sink.warn(new GenerationWarning(WarningCode.DUPLICATE_TARGET, m.targetTable,
                        "target table mapped more than once; later mapping ignored",
                        "source_table=" + m.sourceTable));
                continue;
            }
            buckets.get(Tier.of(m.targetTable)).add(m);
        }

        List<TableMapping> out = new ArrayList<>(mappings.size());
        out.addAll(buckets.get(Tier.DIM));
        out.addAll(buckets.get(Tier.FACT));
        out.addAll(buckets.get(Tier.AGG));

        for (TableMapping m : buckets.get(Tier.OTHER)) {
            if (unknownTierPolicy == UnknownTierPolicy.RENDER_LAST) {
                out.add(m);
                sink.warn(GenerationWarning.of(WarningCode.UNKNOWN_TIER_RENDERED, m.targetTable,
                        "target name has no dim_/fact_/agg_ prefix; rendered after the agg_ tier"));
            } else {
                sink.warn(GenerationWarning.of(WarningCode.UNKNOWN_TIER_SKIPPED, m.targetTable,
                        "target name has no dim_/fact_/agg_ prefix; not rendered"));
            }
        }
        return out;
    }
}
