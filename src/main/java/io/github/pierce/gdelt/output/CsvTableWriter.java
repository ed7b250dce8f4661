package io.github.pierce.gdelt.output;

import io.github.pierce.gdelt.table.Table;
import io.github.pierce.gdelt.table.Values;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a table as RFC 4180 CSV with a header row. Missing values are written as empty fields.
 */
public class CsvTableWriter {

    private final CSVFormat format;

    public CsvTableWriter() {
        this(CSVFormat.DEFAULT.builder().setRecordSeparator("\n").build());
    }

    public CsvTableWriter(CSVFormat format) {
        this.format = format;
    }

    public void write(Path target, Table table) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(writer, table);
        }
    }

    public void write(Writer writer, Table table) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, format.builder()
                .setHeader(table.columns().toArray(new String[0]))
                .build());
        for (int r = 0; r < table.rowCount(); r++) {
            List<String> record = new ArrayList<>(table.columnCount());
            for (int c = 0; c < table.columnCount(); c++) {
                record.add(Values.text(table.get(r, c)));
            }
            printer.printRecord(record);
        }
        printer.flush();
    }
}
