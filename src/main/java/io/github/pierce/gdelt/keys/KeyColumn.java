package io.github.pierce.gdelt.keys;

import io.github.pierce.gdelt.ConfigurationException;

import java.util.List;
import java.util.Objects;

/**
 * Key column(s) of one source table. A secondary table in a three-way join needs two:
 * one for its link to the primary table and one for its link to the tertiary table.
 */
public interface KeyColumn {

    /**
     * Column names in declaration order.
     */
    List<String> columns();

    /**
     * Column used when this table is joined against the primary table.
     */
    String towardsPrimary();

    /**
     * Column used when this table is joined against the tertiary table.
     */
    String towardsTertiary();

    static KeyColumn single(String name) {
        return new SingleKey(name);
    }

    static KeyColumn paired(String first, String second) {
        return new PairedKey(first, second);
    }

    /**
     * Builds a key from the list shape used in configuration files: one name or two.
     *
     * @throws ConfigurationException for zero or more than two names
     */
    static KeyColumn fromList(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException("Key column list must not be empty");
        }
        return switch (names.size()) {
            case 1 -> new SingleKey(names.get(0));
            case 2 -> new PairedKey(names.get(0), names.get(1));
            default -> throw new ConfigurationException(
                    "Key column list must have one or two entries, got " + names.size() + ": " + names);
        };
    }

    record SingleKey(String name) implements KeyColumn {

        public SingleKey {
            requireName(name);
        }

        @Override
        public List<String> columns() {
            return List.of(name);
        }

        @Override
        public String towardsPrimary() {
            return name;
        }

        @Override
        public String towardsTertiary() {
            return name;
        }
    }

    record PairedKey(String first, String second) implements KeyColumn {

        public PairedKey {
            requireName(first);
            requireName(second);
        }

        @Override
        public List<String> columns() {
            return List.of(first, second);
        }

        @Override
        public String towardsPrimary() {
            return first;
        }

        @Override
        public String towardsTertiary() {
            return second;
        }
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "key column name");
        if (name.isBlank()) {
            throw new ConfigurationException("Key column name must not be blank");
        }
    }
}
