package infra.output;

import domain.model.GenerationResult;
import domain.output.SqlOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public void write(Path scriptFile, Path splitDir, GenerationResult result) {
        // intentionally no-op
    }
}
