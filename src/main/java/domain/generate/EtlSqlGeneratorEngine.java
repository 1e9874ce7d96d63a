package domain.generate;

import domain.mapping.MappingDocument;
import domain.mapping.MappingLoadResult;
import domain.mapping.TableMapping;
import domain.mapping.UpstreamMappingError;
import domain.model.GenerationResult;
import domain.model.GenerationWarning;
import domain.model.GenerationWarningSink;
import domain.model.ListGenerationWarningSink;
import domain.model.RenderedStatement;
import domain.model.Strategy;
import domain.model.Tier;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Internal implementation of {@link EtlSqlGenerator}.
 *
 * <p>Split points:
 * <ul>
 *   <li>{@link TierOrderer}: dim_ → fact_ → agg_ order, duplicate and unknown-tier targets</li>
 *   <li>{@link StrategySelector}: DIRECT / UNION / PIVOT / MISSING_SOURCE</li>
 *   <li>{@link ColumnExpressionSynthesizer}: per-column SELECT expressions</li>
 *   <li>{@link StatementRenderer}: INSERT / MERGE / placeholder text</li>
 * </ul>
 */
final class EtlSqlGeneratorEngine {

    static final String BANNER_RULE = "-- ==================================================================";

    private final GenerationOptions options;
    private final TierOrderer orderer;
    private final ColumnExpressionSynthesizer synthesizer;
    private final StatementRenderer renderer;

    EtlSqlGeneratorEngine(GenerationOptions options) {
        this.options = options;
        this.orderer = new TierOrderer(options.getUnknownTierPolicy());
        this.synthesizer = new ColumnExpressionSynthesizer(options);
        this.renderer = new StatementRenderer();
    }

    GenerationResult generate(MappingLoadResult loaded, GenerationWarningSink extraSink) {
        List<GenerationWarning> warnings = new ArrayList<>();
        GenerationWarningSink sink = tee(new ListGenerationWarningSink(warnings), extraSink);

        if (loaded.isRepaired()) {
            sink.warn(new GenerationWarning(WarningCode.REPAIRED_INPUT, "",
                    "mapping JSON was malformed and has been repaired", loaded.getParseDiagnostic()));
        }

        MappingDocument doc = loaded.getDocument();
        List<TableMapping> ordered = orderer.order(doc.getMappings(), sink);

        List<RenderedStatement> statements = new ArrayList<>(ordered.size());
        for (TableMapping m : ordered) {
            int before = warnings.size();
            String sql = render(statements.size() + 1, m, sink);
            List<GenerationWarning> own = List.copyOf(warnings.subList(before, warnings.size()));
            if (sql == null) continue;

            statements.add(new RenderedStatement(statements.size() + 1, m.targetTable,
                    Tier.of(m.targetTable), StrategySelector.select(m), sql, own));
        }

        return new GenerationResult(assemble(loaded, doc, statements), statements, warnings);
    }

    /** @return statement text, or null when the mapping is skipped */
    private String render(int seq, TableMapping m, GenerationWarningSink sink) {
        for (UpstreamMappingError e : m.mappingErrors) {
            sink.warn(new GenerationWarning(WarningCode.UPSTREAM_MAPPING_ERROR, m.targetTable,
                    "mapping step reported an error for this table", e.toString()));
        }

        Tier tier = Tier.of(m.targetTable);
        Strategy strategy = StrategySelector.select(m);

        if (strategy == Strategy.MISSING_SOURCE) {
            sink.warn(GenerationWarning.of(WarningCode.MISSING_SOURCE, m.targetTable,
                    "no source table; a commented placeholder was emitted"));
            return renderer.renderMissingSource(seq, tier, m);
        }

        boolean merge = options.isIdempotent();
        if (merge && m.primaryKey.isEmpty()) {
            sink.warn(GenerationWarning.of(WarningCode.PRIMARY_KEY_MISSING, m.targetTable,
                    "no primary_key for idempotent load; plain INSERT emitted"));
            merge = false;
        }
        String alias = merge ? StatementRenderer.SOURCE_ALIAS : null;

        List<String> sources = m.sourceTables();
        List<SourceSelect> branches = new ArrayList<>(sources.size());
        switch (strategy) {
            case UNION -> {
                for (String src : sources) {
                    branches.add(new SourceSelect(src, alias, synthesizer.unionBranch(m, src, alias)));
                }
            }
            case PIVOT -> {
                String src = sources.get(0);
                SelectProjection p = synthesizer.pivot(m, src);
                if (p.groupBy().isEmpty()) {
                    sink.warn(GenerationWarning.of(WarningCode.PIVOT_GROUPING_EMPTY, m.targetTable,
                            "pivot has no grouping column; statement skipped"));
                    return null;
                }
                branches.add(new SourceSelect(src, null, p));
            }
            default -> {
                String src = sources.get(0);
                branches.add(new SourceSelect(src, alias, synthesizer.direct(m, src, alias)));
            }
        }

        return merge
                ? renderer.renderMerge(seq, tier, strategy, m, branches)
                : renderer.renderInsert(seq, tier, strategy, m, branches);
    }

    private String assemble(MappingLoadResult loaded, MappingDocument doc, List<RenderedStatement> statements) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append(BANNER_RULE).append('\n');
        sb.append("-- ETL load script").append('\n');
        sb.append("-- mappings: ").append(doc.size())
                .append(", statements: ").append(statements.size())
                .append(", mode: ").append(options.isIdempotent() ? "MERGE" : "INSERT").append('\n');
        sb.append(BANNER_RULE).append('\n');
        if (loaded.isRepaired()) {
            sb.append("-- WARNING: input mapping JSON was malformed and has been repaired (")
                    .append(SqlTokens.commentText(loaded.getParseDiagnostic()))
                    .append("). Review every statement before running.\n");
        }
        sb.append('\n');

        for (RenderedStatement s : statements) {
            sb.append(s.getSqlText()).append('\n')
                    .append(StatementRenderer.DELIMITER).append("\n\n");
        }
        return sb.toString();
    }

    private static GenerationWarningSink tee(GenerationWarningSink primary, GenerationWarningSink extra) {
        if (extra == null) return primary;
        return w -> {
            primary.warn(w);
            extra.warn(w);
        };
    }
}
