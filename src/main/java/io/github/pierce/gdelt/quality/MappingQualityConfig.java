package io.github.pierce.gdelt.quality;

import io.github.pierce.gdelt.ValidationException;

import java.util.List;

/**
 * Columns of the joined table to check for unmapped values, and the identifier column that
 * restricts which rows count.
 *
 * @param checkColumns     columns whose empty cells count as unmapped, e.g. {@code Export_AvgTone}
 * @param identifierColumn rows with a blank identifier are excluded, e.g. {@code gkg_V2DOCUMENTIDENTIFIER}
 */
public record MappingQualityConfig(List<String> checkColumns, String identifierColumn) {

    public MappingQualityConfig {
        checkColumns = checkColumns == null ? List.of() : List.copyOf(checkColumns);
        if (identifierColumn == null || identifierColumn.isBlank()) {
            throw new ValidationException("Mapping quality identifier column is required");
        }
    }
}
