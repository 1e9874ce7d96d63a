package domain.mapping;

/**
 * Ratio operands for a derived pivot column, e.g. GDP per capita = GDP / population.
 * Both values are indicator codes of the long-format fact table.
 */
public final class DerivedMetric {

    public final String numeratorCode;
    public final String denominatorCode;

    public DerivedMetric(String numeratorCode, String denominatorCode) {
        if (numeratorCode == null || numeratorCode.isBlank()) {
            throw new IllegalArgumentException("numeratorCode is blank");
        }
        if (denominatorCode == null || denominatorCode.isBlank()) {
            throw new IllegalArgumentException("denominatorCode is blank");
        }
        this.numeratorCode = numeratorCode.trim();
        this.denominatorCode = denominatorCode.trim();
    }
}
