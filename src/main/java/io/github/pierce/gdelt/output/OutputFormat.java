package io.github.pierce.gdelt.output;

import io.github.pierce.gdelt.ValidationException;

import java.util.Locale;

public enum OutputFormat {
    CSV("csv"),
    XLSX("xlsx");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Accepts {@code csv}, {@code xlsx} and {@code xlsm} (written as xlsx).
     */
    public static OutputFormat fromName(String name) {
        if (name != null) {
            switch (name.strip().toLowerCase(Locale.ROOT)) {
                case "csv":
                    return CSV;
                case "xlsx", "xlsm":
                    return XLSX;
                default:
                    break;
            }
        }
        throw new ValidationException("Unsupported output format: " + name + ". Must be 'csv' or 'xlsx'");
    }
}
