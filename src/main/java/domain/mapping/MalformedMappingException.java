package domain.mapping;

/**
 * Mapping input could not be turned into a {@link MappingDocument}: the text is not JSON
 * (even after the repair pass) or its structure is not a mapping document.
 *
 * <p>When caused by a parse failure, the cause is the diagnostic of the first parse attempt.</p>
 */
public final class MalformedMappingException extends RuntimeException {

    public MalformedMappingException(String message) {
        super(message);
    }

    public MalformedMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
