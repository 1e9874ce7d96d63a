package infra.mapping;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import domain.mapping.ColumnMapping;
import domain.mapping.MalformedMappingException;
import domain.mapping.MappingDocument;
import domain.mapping.TableMapping;
import domain.model.Strategy;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV loader for mapping sheets (one row per column mapping).
 *
 * <p>Header (case/space insensitive, order free):
 * source_table, target_table, source_column, target_column, transformation, notes,
 * primary_key, strategy.</p>
 *
 * <p>Rows sharing target_table form one {@link TableMapping} in first-seen order.
 * source_table, primary_key and strategy are taken from the first row of the target that
 * carries them; primary_key is '|'-separated.</p>
 *
 * <p>The header row is read manually (not via withFirstRecordAsHeader) so that blank
 * trailing header cells from spreadsheet exports do not break parsing.</p>
 */
public final class MappingCsvLoader {

    public MappingDocument load(Path csvFile) {
        if (csvFile == null) throw new IllegalArgumentException("csvFile is null");
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            return load(reader, csvFile.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load mapping csv: " + csvFile, e);
        }
    }

    public MappingDocument load(String csvText) {
        try (Reader reader = new StringReader(csvText == null ? "" : csvText)) {
            return load(reader, "<text>");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load mapping csv text", e);
        }
    }

    private MappingDocument load(Reader reader, String label) throws IOException {
        try (CSVParser parser = CSVFormat.DEFAULT
                .builder()
                .setTrim(true)
                .build()
                .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return new MappingDocument(List.of());

            // ---------------------------
            // 1) header row (raw)
            // ---------------------------
            CSVRecord headerRec = it.next();
            Map<String, Integer> headerIndex = new LinkedHashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                String key = norm(stripBom(headerRec.get(i)));
                if (!key.isEmpty()) headerIndex.putIfAbsent(key, i);
            }
            if (!headerIndex.containsKey("targettable") || !headerIndex.containsKey("targetcolumn")) {
                throw new MalformedMappingException(label + ": header must contain target_table and target_column");
            }

            // ---------------------------
            // 2) records grouped by target
            // ---------------------------
            Map<String, TableRows> byTarget = new LinkedHashMap<>();
            while (it.hasNext()) {
                CSVRecord r = it.next();
                String targetTable = get(r, headerIndex, "targettable");
                String targetColumn = get(r, headerIndex, "targetcolumn");

                // spreadsheet exports often end with blank rows
                if (targetTable.isEmpty() && targetColumn.isEmpty()) continue;
                if (targetTable.isEmpty() || targetColumn.isEmpty()) {
                    throw new MalformedMappingException(label + " line " + r.getRecordNumber()
                            + ": target_table and target_column are required");
                }

                TableRows rows = byTarget.computeIfAbsent(targetTable, TableRows::new);
                rows.fillFirst(
                        get(r, headerIndex, "sourcetable"),
                        get(r, headerIndex, "primarykey"),
                        get(r, headerIndex, "strategy")
                );
                rows.columns.add(new ColumnMapping(
                        get(r, headerIndex, "sourcecolumn"),
                        targetColumn,
                        get(r, headerIndex, "transformation"),
                        get(r, headerIndex, "notes"),
                        null
                ));
            }

            List<TableMapping> out = new ArrayList<>(byTarget.size());
            for (TableRows rows : byTarget.values()) out.add(rows.toTableMapping());
            return new MappingDocument(out);
        }
    }

    private static String get(CSVRecord r, Map<String, Integer> idx, String key) {
        Integer i = idx.get(key);
        if (i == null || i >= r.size()) return "";
        String v = r.get(i);
        return v == null ? "" : v.trim();
    }

    private static String norm(String s) {
        if (s == null) return "";
        return s.trim()
                .toLowerCase(Locale.ROOT)
                .replace("_", "")
                .replace(" ", "");
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private static final class TableRows {
        private final String targetTable;
        private final List<ColumnMapping> columns = new ArrayList<>();
        private String sourceTable = "";
        private String primaryKey = "";
        private String strategy = "";

        private TableRows(String targetTable) {
            this.targetTable = targetTable;
        }

        private void fillFirst(String sourceTable, String primaryKey, String strategy) {
            if (this.sourceTable.isEmpty()) this.sourceTable = sourceTable;
            if (this.primaryKey.isEmpty()) this.primaryKey = primaryKey;
            if (this.strategy.isEmpty()) this.strategy = strategy;
        }

        private TableMapping toTableMapping() {
            List<String> pk = new ArrayList<>();
            for (String p : primaryKey.split("\\|")) {
                if (!p.isBlank()) pk.add(p.trim());
            }
            return new TableMapping(sourceTable, targetTable, columns, pk, Strategy.parse(strategy), List.of());
        }
    }
}
