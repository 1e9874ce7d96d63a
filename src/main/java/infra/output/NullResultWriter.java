package infra.output;

import domain.model.GenerationResult;
import domain.output.ResultWriter;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, GenerationResult result) {
        // intentionally no-op
    }
}
