package domain.generate;

import domain.mapping.MappingDocument;
import domain.mapping.MappingLoadResult;
import domain.mapping.MappingParser;
import domain.model.GenerationResult;
import domain.model.GenerationWarningSink;

/**
 * Mapping document in, ordered SQL load script out.
 *
 * <p>Holds only immutable settings, so one instance can be shared across threads.
 * The heavy lifting lives in {@link EtlSqlGeneratorEngine}.</p>
 */
public class EtlSqlGenerator {

    private final MappingParser parser;
    private final GenerationOptions options;
    private final EtlSqlGeneratorEngine engine;

    public EtlSqlGenerator(MappingParser parser) {
        this(parser, GenerationOptions.defaults());
    }

    public EtlSqlGenerator(MappingParser parser, GenerationOptions options) {
        this.parser = parser;
        this.options = options == null ? GenerationOptions.defaults() : options;
        this.engine = new EtlSqlGeneratorEngine(this.options);
    }

    public GenerationOptions getOptions() {
        return options;
    }

    /**
     * @throws domain.mapping.MalformedMappingException when the text cannot be parsed
     *                                                  (after one repair pass, if enabled)
     */
    public GenerationResult generate(String mappingText) {
        if (parser == null) throw new IllegalStateException("no MappingParser configured");
        return generate(parser.parse(mappingText, options.isRepairEnabled()));
    }

    public GenerationResult generate(MappingDocument document) {
        if (document == null) throw new IllegalArgumentException("document is null");
        return generate(MappingLoadResult.clean(document));
    }

    public GenerationResult generate(MappingLoadResult loaded) {
        return generate(loaded, GenerationWarningSink.none());
    }

    /** Same as {@link #generate(MappingLoadResult)}, also forwarding each warning to {@code sink}. */
    public GenerationResult generate(MappingLoadResult loaded, GenerationWarningSink sink) {
        if (loaded == null) throw new IllegalArgumentException("loaded is null");
        return engine.generate(loaded, sink);
    }
}
