package io.github.pierce.gdelt.join;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import io.github.pierce.gdelt.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory hash join of GKG with Mentions and/or Export.
 *
 * <p>Paths:</p>
 * <ul>
 *   <li>GKG + Mentions: {@code gkg_V2DOCUMENTIDENTIFIER = MentionIdentifier}</li>
 *   <li>GKG + Mentions + Export: the above, then {@code mentions.GlobalEventID = export.GlobalEventID}</li>
 *   <li>GKG + Export: {@code gkg_V2DOCUMENTIDENTIFIER = export.SOURCEURL}</li>
 * </ul>
 *
 * <p>Every join is a left outer join anchored on the primary table. Output rows follow primary
 * row order, then matched mentions order, then matched export order. The engine holds no
 * per-call state and can be shared between threads.</p>
 */
public class ConditionalJoinEngine implements JoinEngine {

    private final JoinColumns joinColumns;
    private final Logger log;

    public ConditionalJoinEngine() {
        this(JoinColumns.defaults());
    }

    public ConditionalJoinEngine(JoinColumns joinColumns) {
        this(joinColumns, LoggerFactory.getLogger(ConditionalJoinEngine.class));
    }

    public ConditionalJoinEngine(JoinColumns joinColumns, Logger log) {
        this.joinColumns = joinColumns;
        this.log = log;
    }

    @Override
    public Table join(Table primary, Table secondary, Table tertiary) {
        if (secondary == null && tertiary == null) {
            log.info("Returning gkg only: {} rows", primary.rowCount());
            return primary;
        }

        Table gkg = primary.renameColumns(String::strip);
        Table mentions = secondary != null ? secondary.renameColumns(String::strip) : null;
        Table export = tertiary != null ? tertiary.renameColumns(String::strip) : null;
        joinColumns.requireColumns(gkg, mentions, export);

        List<String> columns = new ArrayList<>(gkg.columns());
        if (mentions != null) {
            joinColumns.secondaryColumns().forEach(c -> columns.add(JoinColumns.secondaryAlias(c)));
        }
        if (export != null) {
            joinColumns.tertiaryColumns().forEach(c -> columns.add(JoinColumns.tertiaryAlias(c)));
        }

        RowWriter writer = new RowWriter(Table.builder(columns), gkg, mentions, export);
        if (mentions != null) {
            joinThroughMentions(gkg, mentions, export, writer);
        } else {
            joinExportBySource(gkg, export, writer);
        }

        Table result = writer.builder.build();
        log.info("Joined data: {} rows, {} columns", result.rowCount(), result.columnCount());
        return result;
    }

    private void joinThroughMentions(Table gkg, Table mentions, Table export, RowWriter writer) {
        int documentIdx = gkg.indexOf(JoinColumns.PRIMARY_DOCUMENT_KEY);
        int mentionIdx = mentions.indexOf(JoinColumns.SECONDARY_DOCUMENT_KEY);
        ListMultimap<String, Integer> mentionsByDocument = index(mentions, mentionIdx);

        ListMultimap<String, Integer> exportByEvent = null;
        int mentionEventIdx = -1;
        int exportEventIdx = -1;
        if (export != null) {
            mentionEventIdx = mentions.indexOf(JoinColumns.EVENT_KEY);
            exportEventIdx = export.indexOf(JoinColumns.EVENT_KEY);
            exportByEvent = index(export, exportEventIdx);
        }

        for (int g = 0; g < gkg.rowCount(); g++) {
            Object document = gkg.get(g, documentIdx);
            List<Integer> matchedMentions = candidates(mentionsByDocument, document).stream()
                    .filter(m -> JoinPredicates.documentMatchesMention(document, mentions.get(m, mentionIdx)))
                    .toList();
            if (matchedMentions.isEmpty()) {
                matchedMentions = Collections.singletonList(null);
            }

            for (Integer m : matchedMentions) {
                if (export == null) {
                    writer.write(g, m, null);
                    continue;
                }
                Object event = m != null ? mentions.get(m, mentionEventIdx) : null;
                int eventIdx = exportEventIdx;
                List<Integer> matchedEvents = candidates(exportByEvent, event).stream()
                        .filter(e -> JoinPredicates.mentionMatchesEvent(event, export.get(e, eventIdx)))
                        .toList();
                if (matchedEvents.isEmpty()) {
                    writer.write(g, m, null);
                } else {
                    for (Integer e : matchedEvents) {
                        writer.write(g, m, e);
                    }
                }
            }
        }
    }

    private void joinExportBySource(Table gkg, Table export, RowWriter writer) {
        int documentIdx = gkg.indexOf(JoinColumns.PRIMARY_DOCUMENT_KEY);
        int sourceIdx = export.indexOf(JoinColumns.TERTIARY_URL_KEY);
        ListMultimap<String, Integer> exportBySource = index(export, sourceIdx);

        for (int g = 0; g < gkg.rowCount(); g++) {
            Object document = gkg.get(g, documentIdx);
            List<Integer> matched = candidates(exportBySource, document).stream()
                    .filter(e -> JoinPredicates.documentMatchesEventSource(document, export.get(e, sourceIdx)))
                    .toList();
            if (matched.isEmpty()) {
                writer.write(g, null, null);
            } else {
                for (Integer e : matched) {
                    writer.write(g, null, e);
                }
            }
        }
    }

    private static ListMultimap<String, Integer> index(Table table, int keyIdx) {
        ListMultimap<String, Integer> index = ArrayListMultimap.create();
        for (int r = 0; r < table.rowCount(); r++) {
            String key = JoinPredicates.matchKey(table.get(r, keyIdx));
            if (key != null) {
                index.put(key, r);
            }
        }
        return index;
    }

    private static List<Integer> candidates(ListMultimap<String, Integer> index, Object value) {
        String key = JoinPredicates.matchKey(value);
        return key == null ? List.of() : index.get(key);
    }

    public JoinColumns getJoinColumns() {
        return joinColumns;
    }

    private final class RowWriter {
        private final Table.Builder builder;
        private final Table gkg;
        private final Table mentions;
        private final Table export;
        private final int[] mentionCols;
        private final int[] exportCols;

        RowWriter(Table.Builder builder, Table gkg, Table mentions, Table export) {
            this.builder = builder;
            this.gkg = gkg;
            this.mentions = mentions;
            this.export = export;
            this.mentionCols = mentions != null
                    ? joinColumns.secondaryColumns().stream().mapToInt(mentions::indexOf).toArray() : new int[0];
            this.exportCols = export != null
                    ? joinColumns.tertiaryColumns().stream().mapToInt(export::indexOf).toArray() : new int[0];
        }

        void write(int g, Integer m, Integer e) {
            List<Object> row = new ArrayList<>(gkg.row(g));
            for (int c : mentionCols) {
                row.add(m != null ? mentions.get(m, c) : null);
            }
            for (int c : exportCols) {
                row.add(e != null ? export.get(e, c) : null);
            }
            builder.addRow(row);
        }
    }
}
