package domain.mapping;

import domain.model.Strategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Source-to-target mapping for one target table.
 */
public final class TableMapping {

    /** {@code source_table} sentinel emitted by the mapping producer when nothing matched. */
    public static final String NO_MATCHING_SOURCE_TABLES = "NO_MATCHING_SOURCE_TABLES";

    public final String sourceTable;
    public final String targetTable;
    public final List<ColumnMapping> columnMappings;
    public final List<String> primaryKey;

    /** Explicit strategy override; null means the name heuristics decide. */
    public final Strategy strategy;
    public final List<UpstreamMappingError> mappingErrors;

    public TableMapping(
            String sourceTable,
            String targetTable,
            List<ColumnMapping> columnMappings,
            List<String> primaryKey,
            Strategy strategy,
            List<UpstreamMappingError> mappingErrors
    ) {
        this.sourceTable = sourceTable == null ? "" : sourceTable.trim();
        this.targetTable = targetTable == null ? "" : targetTable.trim();
        this.columnMappings = columnMappings == null ? List.of() : List.copyOf(columnMappings);
        this.primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
        this.strategy = strategy;
        this.mappingErrors = mappingErrors == null ? List.of() : List.copyOf(mappingErrors);
    }

    public TableMapping(String sourceTable, String targetTable, List<ColumnMapping> columnMappings, List<String> primaryKey) {
        this(sourceTable, targetTable, columnMappings, primaryKey, null, null);
    }

    /**
     * True for the producer sentinel, for {@code "UNMAPPED"} and for a blank source.
     */
    public boolean isSourceMissing() {
        return sourceTable.isEmpty()
                || NO_MATCHING_SOURCE_TABLES.equalsIgnoreCase(sourceTable)
                || ColumnMapping.UNMAPPED.equalsIgnoreCase(sourceTable);
    }

    /** Comma-split, trimmed source table names; blanks dropped. */
    public List<String> sourceTables() {
        List<String> out = new ArrayList<>();
        for (String s : sourceTable.split(",")) {
            String t = s.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public List<String> targetColumns() {
        List<String> out = new ArrayList<>(columnMappings.size());
        for (ColumnMapping c : columnMappings) out.add(c.targetColumn);
        return out;
    }
}
