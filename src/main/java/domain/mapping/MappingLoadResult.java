package domain.mapping;

/**
 * Parsed mapping document plus how it was obtained.
 */
public final class MappingLoadResult {

    private final MappingDocument document;
    private final boolean repaired;

    /** First parse failure message when {@link #isRepaired()}; empty otherwise. */
    private final String parseDiagnostic;

    public MappingLoadResult(MappingDocument document, boolean repaired, String parseDiagnostic) {
        if (document == null) throw new IllegalArgumentException("document is null");
        this.document = document;
        this.repaired = repaired;
        this.parseDiagnostic = parseDiagnostic == null ? "" : parseDiagnostic;
    }

    public static MappingLoadResult clean(MappingDocument document) {
        return new MappingLoadResult(document, false, "");
    }

    public MappingDocument getDocument() {
        return document;
    }

    public boolean isRepaired() {
        return repaired;
    }

    public String getParseDiagnostic() {
        return parseDiagnostic;
    }
}
