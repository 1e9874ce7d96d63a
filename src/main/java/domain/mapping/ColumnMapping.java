package domain.mapping;

/**
 * Column mapping row model.
 *
 * <p>Keep it as a simple immutable DTO (no behavior) so that loaders, the synthesizer and
 * the renderer can share the same type without cyclic dependencies.</p>
 */
public final class ColumnMapping {

    /** {@code source_column} value for a target column with no source. */
    public static final String UNMAPPED = "UNMAPPED";

    /** {@code source_column} value for a target column computed by {@link #transformation}. */
    public static final String GENERATED = "GENERATED";

    public final String sourceColumn;
    public final String targetColumn;

    /** SQL expression or null. */
    public final String transformation;
    public final String notes;

    /** Ratio operands for a pivot column; null unless the mapping supplies them. */
    public final DerivedMetric derivedMetric;

    public ColumnMapping(
            String sourceColumn,
            String targetColumn,
            String transformation,
            String notes,
            DerivedMetric derivedMetric
    ) {
        this.sourceColumn = isBlank(sourceColumn) ? UNMAPPED : sourceColumn.trim();
        this.targetColumn = targetColumn == null ? "" : targetColumn.trim();
        this.transformation = isBlank(transformation) ? null : transformation.trim();
        this.notes = notes;
        this.derivedMetric = derivedMetric;
    }

    public ColumnMapping(String sourceColumn, String targetColumn, String transformation) {
        this(sourceColumn, targetColumn, transformation, null, null);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public boolean isUnmapped() {
        return UNMAPPED.equalsIgnoreCase(sourceColumn);
    }

    public boolean isGenerated() {
        return GENERATED.equalsIgnoreCase(sourceColumn);
    }

    @Override
    public String toString() {
        return "ColumnMapping{" +
                "sourceColumn='" + sourceColumn + '\'' +
                ", targetColumn='" + targetColumn + '\'' +
                ", transformation='" + transformation + '\'' +
                '}';
    }
}
