package io.github.pierce.gdelt.join;

import io.github.pierce.gdelt.table.Table;

/**
 * Left-outer joins the primary table with whichever optional tables are present.
 *
 * <p>Implementations must return the primary table unchanged when both optional tables
 * are null.</p>
 */
public interface JoinEngine {

    Table join(Table primary, Table secondary, Table tertiary);
}
