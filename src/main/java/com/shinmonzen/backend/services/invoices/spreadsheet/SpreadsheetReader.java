package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionException;
import com.shinmonzen.backend.services.invoices.util.AmountParser;

/**
 * Loads workbooks (every sheet) and CSV files into {@link SheetTable}s. Never mutates the source.
 */
@Component
public class SpreadsheetReader {

    private static final char BOM = '\uFEFF';

    public List<SheetTable> readWorkbook(byte[] content) {
        try (InputStream is = new ByteArrayInputStream(content); Workbook workbook = WorkbookFactory.create(is)) {
            List<SheetTable> sheets = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                sheets.add(new SheetTable(sheet.getSheetName(), readRows(sheet)));
            }
            return sheets;
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Unreadable workbook: " + e.getMessage(), e);
        }
    }

    public List<SheetTable> readCsv(byte[] content) {
        return List.of(new SheetTable("csv", new ArrayList<>(readCsvRows(content))));
    }

    /**
     * Raw CSV rows as strings, BOM stripped from the first cell.
     */
    public List<List<Object>> readCsvRows(byte[] content) {
        List<List<Object>> rows = new ArrayList<>();
        try (InputStreamReader isr = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(isr)) {
            String[] line;
            boolean first = true;
            while ((line = reader.readNext()) != null) {
                List<Object> row = new ArrayList<>(line.length);
                for (String cell : line) {
                    row.add(cell);
                }
                if (first && !row.isEmpty() && row.get(0) instanceof String s && !s.isEmpty() && s.charAt(0) == BOM) {
                    row.set(0, s.substring(1));
                }
                first = false;
                rows.add(row);
            }
            return rows;
        } catch (IOException | CsvValidationException e) {
            throw new ExtractionException("Unreadable CSV: " + e.getMessage(), e);
        }
    }

    private static List<List<Object>> readRows(Sheet sheet) {
        List<List<Object>> rows = new ArrayList<>();
        int last = sheet.getLastRowNum();
        for (int r = 0; r <= last; r++) {
            Row row = sheet.getRow(r);
            List<Object> values = new ArrayList<>();
            if (row != null && row.getLastCellNum() > 0) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    values.add(cellValue(row.getCell(c)));
                }
            }
            rows.add(values);
        }
        return rows;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        return switch (type) {
            case STRING -> {
                String s = cell.getStringCellValue();
                yield s == null || s.isBlank() ? null : s.trim();
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toLocalDate()
                    : AmountParser.parseObject(cell.getNumericCellValue());
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> null;
        };
    }
}
