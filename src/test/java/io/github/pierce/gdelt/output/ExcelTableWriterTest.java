package io.github.pierce.gdelt.output;

import io.github.pierce.gdelt.table.Table;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ExcelTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("writes one sheet per table with a styled header")
    void writesSheets() throws Exception {
        Table mapping = Table.builder("Time Stamp", "gkg_V2DOCUMENTIDENTIFIER", "mapped mentions values", "mapped count")
                .addRow("20250101000000", "http://a", List.of("http://a", "http://a"), 2)
                .addRow("20250101000000", null, List.of(), 0)
                .build();
        Map<String, Table> sheets = new LinkedHashMap<>();
        sheets.put("gkg_vs_mentions", mapping);
        sheets.put("mentions_vs_exports", Table.builder("GlobalEventID").addRow(true).build());
        Path file = tempDir.resolve("out.xlsx");

        new ExcelTableWriter().write(file, sheets);

        try (InputStream in = Files.newInputStream(file); Workbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);
            Sheet sheet = workbook.getSheet("gkg_vs_mentions");
            assertThat(sheet.getRow(0).getCell(3).getStringCellValue()).isEqualTo("mapped count");
            assertThat(workbook.getFontAt(sheet.getRow(0).getCell(0).getCellStyle().getFontIndex()).getBold()).isTrue();
            assertThat(sheet.getRow(1).getCell(2).getStringCellValue()).isEqualTo("[http://a, http://a]");
            assertThat(sheet.getRow(1).getCell(3).getNumericCellValue()).isEqualTo(2.0);
            assertThat(sheet.getRow(2).getCell(1).getCellType()).isEqualTo(CellType.BLANK);
            assertThat(workbook.getSheet("mentions_vs_exports").getRow(1).getCell(0).getBooleanCellValue()).isTrue();
        }
    }

    @Test
    @DisplayName("sheet names are sanitized and cut to 31 characters")
    void sanitizesNames() {
        assertThat(ExcelTableWriter.sanitizeSheetName("a/b:c*d?e[f]g\\h")).isEqualTo("a_b_c_d_e_f_g_h");
        assertThat(ExcelTableWriter.sanitizeSheetName("x".repeat(40))).hasSize(31);
        assertThat(ExcelTableWriter.sanitizeSheetName(" ")).isEqualTo("Sheet");
    }

    @Test
    @DisplayName("names that collide after sanitizing get a numeric suffix")
    void collidingNames() throws Exception {
        Map<String, Table> sheets = new LinkedHashMap<>();
        sheets.put("a/b", Table.builder("x").build());
        sheets.put("a:b", Table.builder("y").build());
        Path file = tempDir.resolve("dup.xlsx");

        new ExcelTableWriter().write(file, sheets);

        try (InputStream in = Files.newInputStream(file); Workbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getSheetName(0)).isEqualTo("a_b");
            assertThat(workbook.getSheetName(1)).isEqualTo("a_b_2");
        }
    }
}
