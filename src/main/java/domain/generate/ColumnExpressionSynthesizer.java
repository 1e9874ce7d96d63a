package domain.generate;

import domain.mapping.ColumnMapping;
import domain.mapping.DerivedMetric;
import domain.mapping.TableMapping;
import domain.model.Tier;

import java.util.Locale;

/**
 * Builds the SELECT expression of every target column.
 *
 * <p>Flat loads (DIRECT and each UNION branch), per column:
 * <ol>
 *   <li>transformation with WHERE: its first quoted literal as a constant (indicator code)</li>
 *   <li>transformation {@code DEFAULT: expr}: expr</li>
 *   <li>other transformation: verbatim</li>
 *   <li>UNMAPPED, or GENERATED without transformation: naming-convention default</li>
 *   <li>otherwise the source column</li>
 * </ol>
 * Pivot loads turn indicator rows into columns with {@code MAX(IF(...))}, render every
 * UNMAPPED column as a ratio (any non-WHERE transformation on it is ignored) and group by
 * the plain source columns.</p>
 */
final class ColumnExpressionSynthesizer {

    static final String INDICATOR_CODE_COLUMN = "indicator_code";
    static final String NUMERIC_VALUE_COLUMN = "numeric_value";

    private final GenerationOptions options;

    ColumnExpressionSynthesizer(GenerationOptions options) {
        this.options = options;
    }

    /**
     * SELECT list for a DIRECT load from {@code sourceTable}.
     *
     * @param sourceAlias alias of the source in a MERGE subquery, or null
     */
    SelectProjection direct(TableMapping m, String sourceTable, String sourceAlias) {
        return flat(m, sourceTable, sourceAlias, options.getDefaultLiteral());
    }

    /** SELECT list for one UNION branch; called once per source so defaults may differ per branch. */
    SelectProjection unionBranch(TableMapping m, String sourceTable, String sourceAlias) {
        return flat(m, sourceTable, sourceAlias, options.getUnionOriginLiteral());
    }

    SelectProjection pivot(TableMapping m, String sourceTable) {
        SelectProjection p = new SelectProjection();
        for (ColumnMapping c : m.columnMappings) {
            String t = c.transformation;

            if (SqlTokens.hasWhere(t) && SqlTokens.firstQuotedLiteral(t) != null) {
                p.add(indicatorValue(SqlTokens.firstQuotedLiteral(t)), c.targetColumn);
            } else if (c.derivedMetric != null || c.isUnmapped()) {
                p.add(ratio(c.derivedMetric), c.targetColumn);
            } else if (c.isGenerated()) {
                p.add(generated(c, sourceTable, options.getDefaultLiteral()), c.targetColumn);
            } else {
                p.addGroupBy(c.sourceColumn);
                p.add(t != null ? t : c.sourceColumn, c.targetColumn);
            }
        }
        return p;
    }

    private SelectProjection flat(TableMapping m, String sourceTable, String sourceAlias, String literalTemplate) {
        SelectProjection p = new SelectProjection();
        for (ColumnMapping c : m.columnMappings) {
            p.add(flatExpression(c, sourceTable, sourceAlias, literalTemplate), c.targetColumn);
        }
        return p;
    }

    private String flatExpression(ColumnMapping c, String sourceTable, String sourceAlias, String literalTemplate) {
        String t = c.transformation;
        if (t != null) {
            if (SqlTokens.hasWhere(t)) {
                String code = SqlTokens.firstQuotedLiteral(t);
                if (code != null) return SqlTokens.stringLiteral(code);
            }
            if (SqlTokens.isDefaultDirective(t)) {
                return SqlTokens.defaultDirectiveExpression(t);
            }
            if (sourceAlias != null && !c.isUnmapped() && !c.isGenerated()) {
                return SqlTokens.qualifyBareColumn(t, c.sourceColumn, sourceAlias);
            }
            return t;
        }

        if (c.isUnmapped() || c.isGenerated()) {
            return unmappedDefault(c.targetColumn, sourceTable, literalTemplate);
        }

        if (sourceAlias != null && SqlTokens.isPlainIdentifier(c.sourceColumn)) {
            return sourceAlias + "." + c.sourceColumn;
        }
        return c.sourceColumn;
    }

    /** GENERATED column of a pivot that is not an indicator. */
    private String generated(ColumnMapping c, String sourceTable, String literalTemplate) {
        String t = c.transformation;
        if (t == null) return unmappedDefault(c.targetColumn, sourceTable, literalTemplate);
        if (SqlTokens.isDefaultDirective(t)) return SqlTokens.defaultDirectiveExpression(t);
        return t;
    }

    /**
     * Naming-convention default: timestamps for *at* / *date* columns, a string literal otherwise.
     * Not type-aware.
     */
    static String unmappedDefault(String targetColumn, String sourceTable, String literalTemplate) {
        String name = targetColumn.toLowerCase(Locale.ROOT);
        if (name.contains("at") || name.contains("date")) {
            return "CURRENT_TIMESTAMP()";
        }
        String literal = literalTemplate.replace(GenerationOptions.SOURCE_PLACEHOLDER, Tier.lastSegment(sourceTable));
        return SqlTokens.stringLiteral(literal);
    }

    static String indicatorValue(String indicatorCode) {
        return "MAX(IF(" + INDICATOR_CODE_COLUMN + " = " + SqlTokens.stringLiteral(indicatorCode)
                + ", " + NUMERIC_VALUE_COLUMN + ", NULL))";
    }

    private String ratio(DerivedMetric metric) {
        String num = metric != null ? metric.numeratorCode : options.getRatioNumeratorCode();
        String den = metric != null ? metric.denominatorCode : options.getRatioDenominatorCode();
        return "SAFE_DIVIDE(" + indicatorValue(num) + ", " + indicatorValue(den) + ")";
    }
}
