package io.github.pierce.gdelt.source;

import io.github.pierce.gdelt.ConfigurationException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Column names of each GDELT file type, in file order.
 *
 * <p>The workbook form has one sheet per file type ({@code gkg}, {@code mentions},
 * {@code export}) listing the names in column A below a title row; blank cells are skipped.</p>
 */
public final class HeaderDictionary {

    private final Map<SourceRole, List<String>> headers;

    private HeaderDictionary(Map<SourceRole, List<String>> headers) {
        this.headers = Collections.unmodifiableMap(new EnumMap<>(headers));
    }

    public static HeaderDictionary of(Map<SourceRole, List<String>> headers) {
        Map<SourceRole, List<String>> copy = new EnumMap<>(SourceRole.class);
        headers.forEach((role, names) -> copy.put(role, List.copyOf(names)));
        return new HeaderDictionary(copy);
    }

    public static HeaderDictionary fromWorkbook(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromWorkbook(in);
        }
    }

    /**
     * @throws ConfigurationException if a file type has no sheet
     */
    public static HeaderDictionary fromWorkbook(InputStream in) throws IOException {
        Map<SourceRole, List<String>> headers = new EnumMap<>(SourceRole.class);
        DataFormatter formatter = new DataFormatter();
        try (Workbook workbook = WorkbookFactory.create(in)) {
            for (SourceRole role : SourceRole.values()) {
                Sheet sheet = workbook.getSheet(role.fileKey());
                if (sheet == null) {
                    throw new ConfigurationException("Header dictionary has no sheet named '" + role.fileKey() + "'");
                }
                List<String> names = new ArrayList<>();
                for (Row row : sheet) {
                    if (row.getRowNum() == sheet.getFirstRowNum()) {
                        continue;
                    }
                    Cell cell = row.getCell(0);
                    String name = cell == null ? "" : formatter.formatCellValue(cell).strip();
                    if (!name.isEmpty()) {
                        names.add(name);
                    }
                }
                headers.put(role, List.copyOf(names));
            }
        }
        return new HeaderDictionary(headers);
    }

    public List<String> headers(SourceRole role) {
        List<String> names = headers.get(role);
        if (names == null) {
            throw new ConfigurationException("No headers configured for " + role.fileKey());
        }
        return names;
    }

    public boolean has(SourceRole role) {
        return headers.containsKey(role);
    }
}
