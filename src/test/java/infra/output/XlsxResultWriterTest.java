package infra.output;

import domain.generate.EtlSqlGenerator;
import domain.model.GenerationResult;
import infra.mapping.MappingJsonLoader;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class XlsxResultWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_statements_warnings_and_summary_sheets() throws Exception {
        String mapping = "{\"mappings\": ["
                + "{\"source_table\": \"s.countries\", \"target_table\": \"w.dim_country\","
                + "\"column_mappings\": [{\"source_column\": \"code\", \"target_column\": \"country_key\"}]},"
                + "{\"source_table\": \"NO_MATCHING_SOURCE_TABLES\", \"target_table\": \"w.dim_date\","
                + "\"column_mappings\": [{\"source_column\": \"UNMAPPED\", \"target_column\": \"date_key\"}]}]}";
        GenerationResult result = new EtlSqlGenerator(new MappingJsonLoader()).generate(mapping);

        Path xlsx = tempDir.resolve("report").resolve("etl-result.xlsx");
        new XlsxResultWriter().write(xlsx, result);

        assertTrue(Files.exists(xlsx));
        try (InputStream in = Files.newInputStream(xlsx); Workbook wb = new XSSFWorkbook(in)) {
            Sheet statements = wb.getSheet(XlsxResultWriter.SHEET_STATEMENTS);
            assertNotNull(statements);
            assertEquals(2, statements.getLastRowNum());
            assertEquals("w.dim_country", statements.getRow(1).getCell(2).getStringCellValue());
            assertEquals("MISSING_SOURCE", statements.getRow(2).getCell(3).getStringCellValue());

            Sheet warnings = wb.getSheet(XlsxResultWriter.SHEET_WARNINGS);
            assertEquals(1, warnings.getLastRowNum());
            assertEquals("MISSING_SOURCE", warnings.getRow(1).getCell(0).getStringCellValue());

            Sheet summary = wb.getSheet(XlsxResultWriter.SHEET_SUMMARY);
            String lastKey = summary.getRow(summary.getLastRowNum()).getCell(0).getStringCellValue();
            String lastValue = summary.getRow(summary.getLastRowNum()).getCell(1).getStringCellValue();
            assertEquals("requiresReview", lastKey);
            assertEquals("true", lastValue);
        }
    }
}
