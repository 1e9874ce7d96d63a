package domain.generate;

import domain.mapping.TableMapping;
import domain.mapping.UpstreamMappingError;
import domain.model.Strategy;
import domain.model.Tier;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles statement text: header comments, then INSERT ... SELECT, MERGE, or the
 * commented placeholder of a target without source.
 *
 * <p>Every statement starts with {@code -- [seq] TIER target (STRATEGY)}; the engine puts
 * {@link #DELIMITER} after it. Both lines are what {@link SqlScriptSplitter} keys on.</p>
 */
final class StatementRenderer {

    static final String DELIMITER = "-- ------------------------------------------------------------------";
    static final String TARGET_ALIAS = "T";
    static final String SOURCE_ALIAS = "S";

    String renderInsert(int seq, Tier tier, Strategy strategy, TableMapping m, List<SourceSelect> branches) {
        StringBuilder sb = header(seq, tier, strategy, m, describe(strategy, m, branches, false));
        sb.append("INSERT INTO ").append(SqlTokens.tableRef(m.targetTable))
                .append(" (").append(String.join(", ", m.targetColumns())).append(")\n");
        sb.append(body(branches)).append(';');
        return sb.toString();
    }

    String renderMerge(int seq, Tier tier, Strategy strategy, TableMapping m, List<SourceSelect> branches) {
        List<String> cols = m.targetColumns();

        List<String> on = new ArrayList<>(m.primaryKey.size());
        for (String pk : m.primaryKey) on.add(TARGET_ALIAS + "." + pk + " = " + SOURCE_ALIAS + "." + pk);

        List<String> set = new ArrayList<>(cols.size());
        List<String> values = new ArrayList<>(cols.size());
        for (String c : cols) {
            set.add(TARGET_ALIAS + "." + c + " = " + SOURCE_ALIAS + "." + c);
            values.add(SOURCE_ALIAS + "." + c);
        }

        StringBuilder sb = header(seq, tier, strategy, m, describe(strategy, m, branches, true));
        sb.append("MERGE ").append(SqlTokens.tableRef(m.targetTable)).append(" AS ").append(TARGET_ALIAS).append('\n');
        sb.append("USING (\n").append(indent(body(branches))).append("\n) AS ").append(SOURCE_ALIAS).append('\n');
        sb.append("ON ").append(String.join(" AND ", on)).append('\n');
        sb.append("WHEN MATCHED THEN UPDATE SET ").append(String.join(", ", set)).append('\n');
        sb.append("WHEN NOT MATCHED THEN INSERT (").append(String.join(", ", cols))
                .append(") VALUES (").append(String.join(", ", values)).append(");");
        return sb.toString();
    }

    String renderMissingSource(int seq, Tier tier, TableMapping m) {
        StringBuilder sb = header(seq, tier, Strategy.MISSING_SOURCE, m, null);
        sb.append("-- WARNING: No source table found for target '")
                .append(SqlTokens.commentText(m.targetTable)).append("'.\n");
        sb.append("-- Please define the source and complete the query below.\n");
        sb.append("-- INSERT INTO ").append(SqlTokens.tableRef(m.targetTable))
                .append(" (").append(String.join(", ", m.targetColumns())).append(")\n");
        sb.append("-- SELECT ... ;");
        return sb.toString();
    }

    private static StringBuilder header(int seq, Tier tier, Strategy strategy, TableMapping m, String description) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("-- [").append(seq).append("] ").append(tier).append(' ')
                .append(SqlTokens.commentText(m.targetTable)).append(" (").append(strategy).append(")\n");
        if (description != null) {
            sb.append("-- ").append(SqlTokens.commentText(description)).append('\n');
        }
        for (UpstreamMappingError e : m.mappingErrors) {
            sb.append("-- NOTE: upstream mapping error ").append(SqlTokens.commentText(e.toString())).append('\n');
        }
        return sb;
    }

    private static String describe(Strategy strategy, TableMapping m, List<SourceSelect> branches, boolean merge) {
        String target = "'" + m.targetTable + "'";
        String first = branches.isEmpty() ? "" : "'" + branches.get(0).sourceTable + "'";
        String d = switch (strategy) {
            case UNION -> "Populating " + target + " by UNIONing " + branches.size() + " sources";
            case PIVOT -> "Populating " + target + " by PIVOTING from " + first;
            default -> "Populating " + target + " from " + first;
        };
        if (merge) d += " (idempotent MERGE on " + String.join(", ", m.primaryKey) + ")";
        return d;
    }

    private static String body(List<SourceSelect> branches) {
        List<String> parts = new ArrayList<>(branches.size());
        for (SourceSelect b : branches) parts.add(b.render());
        return String.join("\nUNION ALL\n", parts);
    }

    private static String indent(String text) {
        return "  " + text.replace("\n", "\n  ");
    }
}
