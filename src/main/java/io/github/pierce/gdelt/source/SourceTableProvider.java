package io.github.pierce.gdelt.source;

import java.io.IOException;
import java.util.Set;

/**
 * Delivers the GDELT tables of one 15-minute instant with their headers applied.
 */
public interface SourceTableProvider {

    /**
     * Fetches the tables for {@code roles}; {@link SourceRole#PRIMARY} is always among them.
     * Tables for roles not requested are null in the returned value.
     *
     * @throws IOException if a requested table cannot be read
     */
    SourceTables fetch(String timestamp, Set<SourceRole> roles) throws IOException;
}
