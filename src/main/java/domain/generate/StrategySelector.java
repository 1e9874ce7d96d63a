package domain.generate;

import domain.mapping.TableMapping;
import domain.model.Strategy;
import domain.model.Tier;

/**
 * Picks the SELECT-body shape of a mapping.
 *
 * <p>Order: missing source, explicit {@code strategy} field, comma-joined source (UNION),
 * {@code agg_} target (PIVOT), DIRECT. Pure string heuristics; schema was resolved upstream.</p>
 */
final class StrategySelector {

    private StrategySelector() {
    }

    static Strategy select(TableMapping m) {
        if (m.isSourceMissing()) return Strategy.MISSING_SOURCE;
        if (m.strategy != null) return m.strategy;
        if (m.sourceTable.contains(",")) return Strategy.UNION;
        if (Tier.lastSegment(m.targetTable).contains("agg_")) return Strategy.PIVOT;
        return Strategy.DIRECT;
    }
}
