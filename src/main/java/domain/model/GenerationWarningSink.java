package domain.model;

/**
 * Sink for generation warnings.
 *
 * <p>Warnings are produced by several internal components (loader, orderer, renderer).
 * A simple sink collects them without coupling internals to the CLI or the XLSX writer.</p>
 */
public interface GenerationWarningSink {

    static GenerationWarningSink none() {
        return NullGenerationWarningSink.INSTANCE;
    }

    void warn(GenerationWarning warning);
}
