package infra.output;

import domain.model.GenerationResult;
import domain.model.RenderedStatement;
import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores generated SQL into files.
 * <p>
 * Output layout:
 * <pre>
 * &lt;scriptFile&gt;                 full script, banner included
 * &lt;splitDir&gt;/NN_&lt;table&gt;.sql     one statement per file (optional)
 * </pre>
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path scriptFile, Path splitDir, GenerationResult result) {
        if (scriptFile == null) throw new IllegalArgumentException("scriptFile is null");
        if (result == null) throw new IllegalArgumentException("result is null");

        createParent(scriptFile);
        writeText(scriptFile, result.getSqlText());

        if (splitDir == null) return;
        try {
            Files.createDirectories(splitDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + splitDir, e);
        }
        for (RenderedStatement s : result.getStatements()) {
            Path file = splitDir.resolve(SqlFileNamePolicy.build(s.getSeq(), s.getTargetTable()));
            writeText(file, s.getSqlText() + "\n");
        }
    }

    private static void createParent(Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + parent, e);
        }
    }

    private static void writeText(Path file, String text) {
        try {
            Files.writeString(file, text == null ? "" : text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write sql: " + file, e);
        }
    }
}
