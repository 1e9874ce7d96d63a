package domain.model;

/**
 * A single warning emitted during generation.
 *
 * <p>Warnings are not fatal; they indicate a risk or missing information that
 * operators should review before running the script.</p>
 */
public final class GenerationWarning {

    private final WarningCode code;
    private final String targetTable;
    private final String message;
    private final String detail;

    public GenerationWarning(WarningCode code, String targetTable, String message, String detail) {
        if (code == null) throw new IllegalArgumentException("code is null");
        this.code = code;
        this.targetTable = nullToEmpty(targetTable);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static GenerationWarning of(WarningCode code, String targetTable, String message) {
        return new GenerationWarning(code, targetTable, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getTargetTable() {
        return targetTable;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " " + targetTable + ": " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
