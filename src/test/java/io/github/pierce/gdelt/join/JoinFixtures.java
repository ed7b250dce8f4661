package io.github.pierce.gdelt.join;

import io.github.pierce.gdelt.table.Table;

import java.util.List;

/**
 * Small GKG, Mentions and Export tables shared by the join engine tests.
 */
public final class JoinFixtures {

    public static final JoinColumns COLUMNS = new JoinColumns(
            List.of("MentionDocTone"),
            List.of("AvgTone", "GlobalEventID"));

    private JoinFixtures() {
    }

    public static Table gkg() {
        return Table.builder("gkg_GKGRECORDID", "gkg_V2DOCUMENTIDENTIFIER", "gkg_ACTUAL_TONE")
                .addRow("r1", "http://a", "-1.5")
                .addRow("r2", "http://b", "2.0")
                .addRow("r3", null, "0.0")
                .addRow("r4", " http://c ", "3.5")
                .build();
    }

    public static Table mentions() {
        return Table.builder("GlobalEventID", "MentionIdentifier", "MentionDocTone")
                .addRow("100", "http://a", "-1.0")
                .addRow("101", "http://a", "-2.0")
                .addRow("102", "http://c", "4.0")
                .addRow("103", null, "0.5")
                .build();
    }

    public static Table export() {
        return Table.builder("GlobalEventID", "SOURCEURL", "AvgTone")
                .addRow("100", "http://a", "-3.0")
                .addRow("102", "http://c", "1.0")
                .addRow("102", "http://c", "1.1")
                .addRow("104", "http://b", "2.2")
                .build();
    }
}
