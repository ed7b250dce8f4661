package io.github.pierce.gdelt.quality;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Empty-value count of one column over the rows with a filled identifier. When the column
 * is absent only {@code note} is set.
 */
public record CompletenessStat(Long emptyCount, String percentOfRows, Long rowsChecked, String note) {

    public static final String COLUMN_NOT_FOUND = "Column not found";

    public static CompletenessStat columnNotFound() {
        return new CompletenessStat(null, null, null, COLUMN_NOT_FOUND);
    }

    public static CompletenessStat of(long emptyCount, long rowsChecked) {
        double ratio = rowsChecked > 0 ? (double) emptyCount / rowsChecked : 0.0;
        return new CompletenessStat(emptyCount, String.format(Locale.ROOT, "%.2f%%", ratio * 100),
                rowsChecked, null);
    }

    public boolean isColumnFound() {
        return note == null;
    }

    /**
     * Report form keyed as {@code Empty}, {@code as_%_of_total_rows} and {@code rows_checked}
     * (or {@code note} for an absent column).
     */
    public Map<String, Object> toReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("Empty", emptyCount);
        report.put("as_%_of_total_rows", percentOfRows);
        if (isColumnFound()) {
            report.put("rows_checked", rowsChecked);
        } else {
            report.put("note", note);
        }
        return report;
    }
}
