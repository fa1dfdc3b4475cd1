package infra.output;

import domain.model.BatchResultRow;
import domain.model.TranslationWarning;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per query (SUCCESS/FALLBACK/FAILED/SKIP)</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class TranslationResultXlsxWriter {

    static final String[] RESULT_HEADERS = {
            "status", "queryId", "query", "sql", "method", "dsl", "elapsedMs", "message"
    };

    static final String[] WARNING_HEADERS = {
            "code", "queryId", "query", "message", "detail"
    };

    private static void header(Sheet sh, String[] names) {
        Row header = sh.createRow(0);
        for (int i = 0; i < names.length; i++) {
            header.createCell(i).setCellValue(names[i]);
        }
    }

    private static void writeResultSheet(Workbook wb, List<BatchResultRow> results) {
        Sheet sh = wb.createSheet("result");
        header(sh, RESULT_HEADERS);

        int r = 1;
        for (BatchResultRow it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(it.getStatus());
            row.createCell(1).setCellValue(it.getQueryId());
            row.createCell(2).setCellValue(it.getQuery());
            row.createCell(3).setCellValue(it.getSql());
            row.createCell(4).setCellValue(it.getMethod());
            row.createCell(5).setCellValue(it.getDsl());
            row.createCell(6).setCellValue(it.getElapsedMs());
            row.createCell(7).setCellValue(it.getMessage());
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<TranslationWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        header(sh, WARNING_HEADERS);

        int r = 1;
        for (TranslationWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(w.getCode().name());
            row.createCell(1).setCellValue(w.getQueryId());
            row.createCell(2).setCellValue(w.getQuery());
            row.createCell(3).setCellValue(w.getMessage());
            row.createCell(4).setCellValue(w.getDetail());
        }
    }

    public void write(Path resultXlsx, List<BatchResultRow> results, List<TranslationWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
