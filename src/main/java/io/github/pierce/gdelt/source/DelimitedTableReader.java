package io.github.pierce.gdelt.source;

import com.google.common.base.Splitter;
import io.github.pierce.gdelt.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads GDELT's headerless, tab-separated, unquoted files into a {@link Table}.
 *
 * <p>Empty fields become null. When the expected header count matches the file's field
 * count the headers are applied; otherwise a warning is logged and the columns are named
 * by position ({@code "0"}, {@code "1"}, ...).</p>
 */
public class DelimitedTableReader {

    private static final Splitter TAB = Splitter.on('\t');

    private final Logger log;

    public DelimitedTableReader() {
        this(LoggerFactory.getLogger(DelimitedTableReader.class));
    }

    public DelimitedTableReader(Logger log) {
        this.log = log;
    }

    public Table read(InputStream in, String fileType, List<String> headers) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        int width = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                List<String> fields = TAB.splitToList(line);
                width = Math.max(width, fields.size());
                rows.add(fields);
            }
        }

        List<String> columns;
        if (headers != null && headers.size() == width) {
            columns = headers;
        } else {
            log.warn("Header mismatch for {}: file has {} columns, dictionary has {} headers",
                    fileType, width, headers == null ? 0 : headers.size());
            columns = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                columns.add(String.valueOf(i));
            }
        }

        Table.Builder builder = Table.builder(columns);
        for (List<String> fields : rows) {
            Object[] values = new Object[width];
            for (int i = 0; i < fields.size(); i++) {
                String field = fields.get(i);
                values[i] = field.isEmpty() ? null : field;
            }
            builder.addRow(values);
        }
        Table table = builder.build();
        log.info("Loaded {}: {} rows", fileType, table.rowCount());
        return table;
    }
}
