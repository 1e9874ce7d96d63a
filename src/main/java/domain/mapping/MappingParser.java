package domain.mapping;

/**
 * Turns raw mapping text into a {@link MappingDocument}.
 *
 * <p>Implementations live in infra (JSON via Jackson); the generator only sees this seam.</p>
 */
public interface MappingParser {

    /**
     * @param repairEnabled try one repair pass when the text does not parse as-is
     * @throws MalformedMappingException when the text cannot be turned into a document
     */
    MappingLoadResult parse(String text, boolean repairEnabled);
}
