package domain.model;
/** No-op warning sink. */
final class NullGenerationWarningSink implements GenerationWarningSink {

    static final NullGenerationWarningSink INSTANCE = new NullGenerationWarningSink();

    private NullGenerationWarningSink() {
    }

    @Override
    public void warn(GenerationWarning warning) {
        // no-op
    }
}
