package infra.output;

import domain.model.GenerationResult;
import domain.model.GenerationSummary;
import domain.model.GenerationWarning;
import domain.model.RenderedStatement;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>statements: one row per emitted statement, in script order</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 *   <li>summary: key/value counters and the review flag</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    /** Excel refuses cells longer than this. */
    static final int MAX_CELL_LENGTH = 32_767;

    static final String SHEET_STATEMENTS = "statements";
    static final String SHEET_WARNINGS = "warnings";
    static final String SHEET_SUMMARY = "summary";

    private static void writeStatementsSheet(Workbook wb, List<RenderedStatement> statements) {
        Sheet sh = wb.createSheet(SHEET_STATEMENTS);
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0).setCellValue("seq");
        header.createCell(1).setCellValue("tier");
        header.createCell(2).setCellValue("targetTable");
        header.createCell(3).setCellValue("strategy");
        header.createCell(4).setCellValue("warnings");
        header.createCell(5).setCellValue("sql");

        for (RenderedStatement it : statements) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(it.getSeq());
            row.createCell(1).setCellValue(it.getTier() == null ? "" : it.getTier().name());
            row.createCell(2).setCellValue(it.getTargetTable());
            row.createCell(3).setCellValue(it.getStrategy() == null ? "" : it.getStrategy().name());
            row.createCell(4).setCellValue(it.getWarnings().size());
            row.createCell(5).setCellValue(clip(it.getSqlText()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<GenerationWarning> warnings) {
        Sheet sh = wb.createSheet(SHEET_WARNINGS);
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0).setCellValue("code");
        header.createCell(1).setCellValue("targetTable");
        header.createCell(2).setCellValue("message");
        header.createCell(3).setCellValue("detail");

        for (GenerationWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(w.getCode().name());
            row.createCell(1).setCellValue(w.getTargetTable());
            row.createCell(2).setCellValue(w.getMessage());
            row.createCell(3).setCellValue(clip(w.getDetail()));
        }
    }

    private static void writeSummarySheet(Workbook wb, GenerationSummary s) {
        Sheet sh = wb.createSheet(SHEET_SUMMARY);
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0).setCellValue("key");
        header.createCell(1).setCellValue("value");

        r = pair(sh, r, "renderedCount", String.valueOf(s.getRenderedCount()));
        r = pair(sh, r, "missingSourceCount", String.valueOf(s.getMissingSourceCount()));
        r = pair(sh, r, "missingSourceTargets", String.join(", ", s.getMissingSourceTargets()));
        r = pair(sh, r, "skippedTargets", String.join(", ", s.getSkippedTargets()));
        r = pair(sh, r, "repairedInput", String.valueOf(s.isRepairedInput()));
        r = pair(sh, r, "warningCount", String.valueOf(s.getWarningCount()));
        pair(sh, r, "requiresReview", String.valueOf(s.requiresReview()));
    }

    private static int pair(Sheet sh, int r, String key, String value) {
        Row row = sh.createRow(r);
        row.createCell(0).setCellValue(key);
        row.createCell(1).setCellValue(clip(value));
        return r + 1;
    }

    private static String clip(String s) {
        if (s == null) return "";
        return s.length() <= MAX_CELL_LENGTH ? s : s.substring(0, MAX_CELL_LENGTH);
    }

    @Override
    public void write(Path resultXlsx, GenerationResult result) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (result == null) throw new IllegalArgumentException("result is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeStatementsSheet(wb, result.getStatements());
            writeWarningsSheet(wb, result.getWarnings());
            writeSummarySheet(wb, result.getSummary());

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
