package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.table.Table;

import java.util.List;

/**
 * Positional view of a batch result, shaped by the statistics level:
 * <ul>
 *   <li>{@code NONE}: {@code [joined]}</li>
 *   <li>{@code KEY_COLUMNS_STATS}: {@code [mappingTables, joined]}</li>
 *   <li>{@code ALL}: {@code [keyColumnStats, mappingTables, joined, completeness]}</li>
 * </ul>
 * Mapping tables are the flattened workbook when flattening is on, otherwise keyed by timestamp.
 */
public record LegacyTuple(StatisticsLevel level, List<Object> elements) {

    public LegacyTuple {
        elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public Object get(int index) {
        return elements.get(index);
    }

    public Table joined() {
        return (Table) elements.get(switch (level) {
            case NONE -> 0;
            case KEY_COLUMNS_STATS -> 1;
            case ALL -> 2;
        });
    }
}
