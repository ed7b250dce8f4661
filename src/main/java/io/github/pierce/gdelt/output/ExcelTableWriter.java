package io.github.pierce.gdelt.output;

import io.github.pierce.gdelt.table.Table;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes tables as sheets of an xlsx workbook with a bold grey header row.
 */
public class ExcelTableWriter {

    static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final int MAX_CELL_TEXT_LENGTH = 32767;

    public void write(Path target, Map<String, Table> sheets) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(target)) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            Map<String, Table> named = new LinkedHashMap<>();
            sheets.forEach((name, table) -> named.put(uniqueName(named, sanitizeSheetName(name)), table));
            for (Map.Entry<String, Table> entry : named.entrySet()) {
                writeSheet(workbook.createSheet(entry.getKey()), entry.getValue(), headerStyle);
            }
            workbook.write(out);
        }
    }

    private void writeSheet(Sheet sheet, Table table, CellStyle headerStyle) {
        Row header = sheet.createRow(0);
        for (int c = 0; c < table.columnCount(); c++) {
            Cell cell = header.createCell(c);
            cell.setCellValue(table.columns().get(c));
            cell.setCellStyle(headerStyle);
        }
        for (int r = 0; r < table.rowCount(); r++) {
            Row row = sheet.createRow(r + 1);
            for (int c = 0; c < table.columnCount(); c++) {
                setValue(row.createCell(c), table.get(r, c));
            }
        }
    }

    private static void setValue(Cell cell, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Double d && d.isNaN()) {
            return;
        }
        if (value instanceof Number n && !(value instanceof BigInteger)) {
            cell.setCellValue(n.doubleValue());
        } else if (value instanceof Boolean b) {
            cell.setCellValue(b);
        } else {
            String text = String.valueOf(value);
            cell.setCellValue(text.length() > MAX_CELL_TEXT_LENGTH ? text.substring(0, MAX_CELL_TEXT_LENGTH) : text);
        }
    }

    /**
     * Replaces {@code : * ? / \ [ ]} with {@code _} and cuts the name to Excel's 31 characters.
     */
    static String sanitizeSheetName(String name) {
        String safe = String.valueOf(name)
                .replace(':', '_').replace('*', '_').replace('?', '_')
                .replace('/', '_').replace('\\', '_')
                .replace('[', '_').replace(']', '_');
        if (safe.isBlank()) {
            safe = "Sheet";
        }
        return safe.length() > MAX_SHEET_NAME_LENGTH ? safe.substring(0, MAX_SHEET_NAME_LENGTH) : safe;
    }

    private static String uniqueName(Map<String, Table> taken, String name) {
        String candidate = name;
        int suffix = 2;
        while (containsIgnoreCase(taken, candidate)) {
            String tail = "_" + suffix++;
            candidate = name.substring(0, Math.min(name.length(), MAX_SHEET_NAME_LENGTH - tail.length())) + tail;
        }
        return candidate;
    }

    private static boolean containsIgnoreCase(Map<String, Table> taken, String name) {
        return taken.keySet().stream().anyMatch(existing -> existing.equalsIgnoreCase(name));
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }
}
