package domain.output;

import domain.model.GenerationResult;

import java.nio.file.Path;

/** Stores the run report (statements, warnings, summary). */
public interface ResultWriter {

    void write(Path resultXlsx, GenerationResult result);
}
