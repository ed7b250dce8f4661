package io.github.pierce.gdelt.source;

import io.github.pierce.gdelt.table.Table;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The tables delivered for one processing instant. The primary table is always present;
 * the optional ones are null when the join case does not involve them.
 */
public record SourceTables(Table primary, Table secondary, Table tertiary) {

    public SourceTables {
        Objects.requireNonNull(primary, "primary table is required");
    }

    public static SourceTables primaryOnly(Table primary) {
        return new SourceTables(primary, null, null);
    }

    public Table get(SourceRole role) {
        return switch (role) {
            case PRIMARY -> primary;
            case SECONDARY -> secondary;
            case TERTIARY -> tertiary;
        };
    }

    public boolean has(SourceRole role) {
        return get(role) != null;
    }

    public Set<SourceRole> presentRoles() {
        Set<SourceRole> roles = EnumSet.noneOf(SourceRole.class);
        for (SourceRole role : SourceRole.values()) {
            if (has(role)) {
                roles.add(role);
            }
        }
        return roles;
    }

    public SourceTables withPrimary(Table table) {
        return new SourceTables(table, secondary, tertiary);
    }

    public SourceTables withTertiary(Table table) {
        return new SourceTables(primary, secondary, table);
    }
}
