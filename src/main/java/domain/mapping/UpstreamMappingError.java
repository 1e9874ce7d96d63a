package domain.mapping;

/** Entry of the {@code mapping_errors} list attached by the mapping producer. */
public final class UpstreamMappingError {

    public final String errorType;
    public final String severity;
    public final String message;

    public UpstreamMappingError(String errorType, String severity, String message) {
        this.errorType = errorType == null ? "" : errorType.trim();
        this.severity = severity == null ? "" : severity.trim();
        this.message = message == null ? "" : message.trim();
    }

    @Override
    public String toString() {
        return "[" + errorType + (severity.isEmpty() ? "" : "/" + severity) + "] " + message;
    }
}
