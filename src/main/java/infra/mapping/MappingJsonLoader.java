package infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import domain.mapping.ColumnMapping;
import domain.mapping.DerivedMetric;
import domain.mapping.MalformedMappingException;
import domain.mapping.MappingDocument;
import domain.mapping.MappingJsonRepairer;
import domain.mapping.MappingLoadResult;
import domain.mapping.MappingParser;
import domain.mapping.TableMapping;
import domain.mapping.UpstreamMappingError;
import domain.model.Strategy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON loader for mapping documents.
 *
 * <p>Accepted envelopes:
 * <ul>
 *   <li>{@code {"mapping": {"mappings": [...]}}} as produced by the schema-mapping step</li>
 *   <li>{@code {"mappings": [...]}}</li>
 * </ul>
 * Unknown fields (match_confidence, source_type, validation_rules, ...) are ignored.</p>
 */
public final class MappingJsonLoader implements MappingParser {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Parse mapping JSON, trying one repair pass when {@code repairEnabled}.
     *
     * @throws MalformedMappingException when the text does not parse (after repair) or
     *                                   is not shaped like a mapping document
     */
    public MappingLoadResult load(String text, boolean repairEnabled) {
        JsonNode root;
        try {
            root = readTree(text);
        } catch (JsonProcessingException first) {
            String diagnostic = diagnostic(first);
            if (!repairEnabled) {
                throw new MalformedMappingException("Mapping JSON could not be parsed: " + diagnostic, first);
            }

            String repaired = MappingJsonRepairer.repair(text);
            if (repaired.equals(text == null ? "" : text.strip())) {
                throw new MalformedMappingException("Mapping JSON could not be parsed and repair changed nothing: "
                        + diagnostic, first);
            }
            try {
                root = readTree(repaired);
            } catch (JsonProcessingException second) {
                MalformedMappingException ex = new MalformedMappingException(
                        "Mapping JSON could not be parsed, even after repair: " + diagnostic, first);
                ex.addSuppressed(second);
                throw ex;
            }
            return new MappingLoadResult(toDocument(root), true, diagnostic);
        }
        return MappingLoadResult.clean(toDocument(root));
    }

    @Override
    public MappingLoadResult parse(String text, boolean repairEnabled) {
        return load(text, repairEnabled);
    }

    public MappingLoadResult load(Path jsonFile, boolean repairEnabled) {
        if (jsonFile == null) throw new IllegalArgumentException("jsonFile is null");
        String text;
        try {
            text = Files.readString(jsonFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read mapping json: " + jsonFile, e);
        }
        return load(text, repairEnabled);
    }

    private static JsonNode readTree(String text) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(text == null ? "" : text);
        if (root == null || root.isMissingNode()) {
            throw new EmptyInputException();
        }
        return root;
    }

    private static String diagnostic(JsonProcessingException e) {
        String msg = e.getOriginalMessage();
        if (e.getLocation() != null) {
            msg += " (line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr() + ")";
        }
        return msg;
    }

    // ------------------------------------------------------------
    // tree -> model
    // ------------------------------------------------------------

    static MappingDocument toDocument(JsonNode root) {
        if (!root.isObject()) {
            throw new MalformedMappingException("$: mapping document must be a JSON object");
        }

        String basePath = "$";
        JsonNode container = root;
        JsonNode wrapped = root.get("mapping");
        if (wrapped != null && wrapped.isObject()) {
            container = wrapped;
            basePath = "$.mapping";
        }

        JsonNode mappings = container.get("mappings");
        if (mappings == null || !mappings.isArray()) {
            throw new MalformedMappingException(basePath + ".mappings: expected an array");
        }

        List<TableMapping> out = new ArrayList<>(mappings.size());
        for (int i = 0; i < mappings.size(); i++) {
            out.add(toTableMapping(mappings.get(i), basePath + ".mappings[" + i + "]"));
        }
        return new MappingDocument(out);
    }

    private static TableMapping toTableMapping(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new MalformedMappingException(path + ": expected an object");
        }

        String targetTable = text(node, "target_table", path);
        if (targetTable == null || targetTable.isBlank()) {
            throw new MalformedMappingException(path + ".target_table: missing or blank");
        }

        JsonNode columns = node.get("column_mappings");
        if (columns == null || !columns.isArray()) {
            throw new MalformedMappingException(path + ".column_mappings: expected an array");
        }
        if (columns.isEmpty()) {
            throw new MalformedMappingException(path + ".column_mappings: expected at least one column");
        }

        List<ColumnMapping> columnMappings = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            columnMappings.add(toColumnMapping(columns.get(i), path + ".column_mappings[" + i + "]"));
        }

        return new TableMapping(
                text(node, "source_table", path),
                targetTable,
                columnMappings,
                stringList(node.get("primary_key")),
                Strategy.parse(text(node, "strategy", path)),
                upstreamErrors(node.get("mapping_errors"), path + ".mapping_errors")
        );
    }

    private static ColumnMapping toColumnMapping(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new MalformedMappingException(path + ": expected an object");
        }
        String targetColumn = text(node, "target_column", path);
        if (targetColumn == null || targetColumn.isBlank()) {
            throw new MalformedMappingException(path + ".target_column: missing or blank");
        }

        DerivedMetric metric = null;
        JsonNode dm = node.get("derived_metric");
        if (dm != null && !dm.isNull()) {
            try {
                String metricPath = path + ".derived_metric";
                metric = new DerivedMetric(text(dm, "numerator_code", metricPath), text(dm, "denominator_code", metricPath));
            } catch (IllegalArgumentException e) {
                throw new MalformedMappingException(path + ".derived_metric: " + e.getMessage(), e);
            }
        }

        return new ColumnMapping(
                text(node, "source_column", path),
                targetColumn,
                text(node, "transformation", path),
                text(node, "notes", path),
                metric
        );
    }

    private static List<UpstreamMappingError> upstreamErrors(JsonNode node, String path) {
        if (node == null || !node.isArray()) return List.of();
        List<UpstreamMappingError> out = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode e = node.get(i);
            String errorPath = path + "[" + i + "]";
            if (e.isObject()) {
                out.add(new UpstreamMappingError(text(e, "error_type", errorPath), text(e, "severity", errorPath),
                        text(e, "message", errorPath)));
            } else if (e.isValueNode()) {
                out.add(new UpstreamMappingError("", "", e.asText()));
            }
        }
        return out;
    }

    /** Array of scalars, or a single scalar. */
    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode n : node) {
                if (n.isValueNode() && !n.isNull() && !n.asText().isBlank()) out.add(n.asText().trim());
            }
        } else if (node.isValueNode() && !node.asText().isBlank()) {
            out.add(node.asText().trim());
        }
        return out;
    }

    /** Scalar field as text; an object or array where a string belongs is a structural error. */
    private static String text(JsonNode node, String field, String path) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isValueNode()) {
            throw new MalformedMappingException(path + "." + field + ": expected a string, got " + v.getNodeType());
        }
        return v.asText();
    }

    /** Blank input parses to a missing node; report it like any other parse failure. */
    private static final class EmptyInputException extends JsonProcessingException {
        EmptyInputException() {
            super("No content to map due to end-of-input");
        }
    }
}
