package domain.output;

import domain.model.GenerationResult;

import java.nio.file.Path;

/** Exports a generated script (and optionally one file per statement). */
public interface SqlOutputWriter {

    /**
     * @param scriptFile full script destination
     * @param splitDir   directory for one file per statement, or null to skip
     */
    void write(Path scriptFile, Path splitDir, GenerationResult result);
}
