package io.github.pierce.gdelt.spark;

import io.github.pierce.gdelt.join.JoinColumns;
import io.github.pierce.gdelt.join.JoinEngine;
import io.github.pierce.gdelt.table.Table;
import io.github.pierce.gdelt.table.Values;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the GKG/Mentions/Export join as Spark SQL over temporary views.
 *
 * <p>Each call registers its tables in a fresh {@link SparkSession#newSession()}, so views
 * from concurrent or earlier calls never collide. The generated statement uses the same
 * three predicates as {@link io.github.pierce.gdelt.join.ConditionalJoinEngine}, comparing
 * {@code TRIM(CAST(... AS STRING))} on both sides, and row order is forced to primary,
 * then mentions, then export input order.</p>
 *
 * <p>Column types are inferred per column: integral values come back as {@link Long},
 * other numbers as {@link Double}, booleans as {@link Boolean}; anything else is rendered
 * as a string.</p>
 */
public class SparkConditionalJoinEngine implements JoinEngine {

    static final String PRIMARY_ORDINAL = "__gkg_ordinal";
    static final String SECONDARY_ORDINAL = "__mentions_ordinal";
    static final String TERTIARY_ORDINAL = "__export_ordinal";

    private final SparkSession spark;
    private final JoinColumns joinColumns;
    private final Logger log;

    public SparkConditionalJoinEngine(SparkSession spark) {
        this(spark, JoinColumns.defaults());
    }

    public SparkConditionalJoinEngine(SparkSession spark, JoinColumns joinColumns) {
        this(spark, joinColumns, LoggerFactory.getLogger(SparkConditionalJoinEngine.class));
    }

    public SparkConditionalJoinEngine(SparkSession spark, JoinColumns joinColumns, Logger log) {
        this.spark = spark;
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

        SparkSession session = spark.newSession();
        toDataset(session, gkg, PRIMARY_ORDINAL).createOrReplaceTempView("gkg");
        if (mentions != null) {
            toDataset(session, mentions, SECONDARY_ORDINAL).createOrReplaceTempView("mentions");
        }
        if (export != null) {
            toDataset(session, export, TERTIARY_ORDINAL).createOrReplaceTempView("export");
        }

        String query = buildQuery(gkg, mentions != null, export != null);
        log.debug("Join query:\n{}", query);

        Dataset<Row> joined = session.sql(query);
        List<String> columns = new ArrayList<>(gkg.columns());
        if (mentions != null) {
            joinColumns.secondaryColumns().forEach(c -> columns.add(JoinColumns.secondaryAlias(c)));
        }
        if (export != null) {
            joinColumns.tertiaryColumns().forEach(c -> columns.add(JoinColumns.tertiaryAlias(c)));
        }

        Table.Builder builder = Table.builder(columns);
        for (Row row : joined.collectAsList()) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = row.get(i);
            }
            builder.addRow(values);
        }
        Table result = builder.build();
        log.info("Joined data: {} rows, {} columns", result.rowCount(), result.columnCount());
        return result;
    }

    String buildQuery(Table gkg, boolean hasMentions, boolean hasExport) {
        List<String> selections = new ArrayList<>();
        gkg.columns().forEach(c -> selections.add("g." + quote(c)));
        if (hasMentions) {
            joinColumns.secondaryColumns().forEach(c ->
                    selections.add("m." + quote(c) + " AS " + quote(JoinColumns.secondaryAlias(c))));
        }
        if (hasExport) {
            joinColumns.tertiaryColumns().forEach(c ->
                    selections.add("e." + quote(c) + " AS " + quote(JoinColumns.tertiaryAlias(c))));
        }

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(",\n    ", selections))
                .append("\nFROM gkg AS g");
        List<String> order = new ArrayList<>(List.of("g." + PRIMARY_ORDINAL));
        if (hasMentions) {
            sql.append("\nLEFT JOIN mentions AS m\n    ON ")
                    .append(textEquals("g", JoinColumns.PRIMARY_DOCUMENT_KEY, "m", JoinColumns.SECONDARY_DOCUMENT_KEY));
            order.add("m." + SECONDARY_ORDINAL);
        }
        if (hasExport) {
            sql.append("\nLEFT JOIN export AS e\n    ON ");
            if (hasMentions) {
                sql.append(textEquals("m", JoinColumns.EVENT_KEY, "e", JoinColumns.EVENT_KEY));
            } else {
                sql.append(textEquals("g", JoinColumns.PRIMARY_DOCUMENT_KEY, "e", JoinColumns.TERTIARY_URL_KEY));
            }
            order.add("e." + TERTIARY_ORDINAL);
        }
        sql.append("\nORDER BY ").append(order.stream()
                .map(c -> c + " ASC NULLS FIRST")
                .collect(Collectors.joining(", ")));
        return sql.toString();
    }

    private static String textEquals(String leftAlias, String leftColumn, String rightAlias, String rightColumn) {
        return "TRIM(CAST(" + leftAlias + "." + quote(leftColumn) + " AS STRING)) = TRIM(CAST("
                + rightAlias + "." + quote(rightColumn) + " AS STRING))";
    }

    static String quote(String column) {
        return "`" + column.replace("`", "``") + "`";
    }

    static Dataset<Row> toDataset(SparkSession session, Table table, String ordinalColumn) {
        List<StructField> fields = new ArrayList<>();
        List<DataType> types = new ArrayList<>();
        for (String column : table.columns()) {
            DataType type = inferType(table, table.indexOf(column));
            types.add(type);
            fields.add(DataTypes.createStructField(column, type, true));
        }
        fields.add(DataTypes.createStructField(ordinalColumn, DataTypes.LongType, false));
        StructType schema = DataTypes.createStructType(fields);

        List<Row> rows = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            Object[] values = new Object[table.columnCount() + 1];
            for (int c = 0; c < table.columnCount(); c++) {
                values[c] = toSparkValue(table.get(r, c), types.get(c));
            }
            values[table.columnCount()] = (long) r;
            rows.add(RowFactory.create(values));
        }
        return session.createDataFrame(rows, schema);
    }

    static DataType inferType(Table table, int column) {
        boolean integral = true;
        boolean numeric = true;
        boolean bool = true;
        boolean seen = false;
        for (int r = 0; r < table.rowCount(); r++) {
            Object value = table.get(r, column);
            if (Values.isMissing(value)) {
                continue;
            }
            seen = true;
            integral &= value instanceof Long || value instanceof Integer || value instanceof Short;
            numeric &= value instanceof Number && !(value instanceof BigInteger)
                    && !(value instanceof BigDecimal);
            bool &= value instanceof Boolean;
        }
        if (!seen) {
            return DataTypes.StringType;
        }
        if (integral) {
            return DataTypes.LongType;
        }
        if (numeric) {
            return DataTypes.DoubleType;
        }
        return bool ? DataTypes.BooleanType : DataTypes.StringType;
    }

    private static Object toSparkValue(Object value, DataType type) {
        if (Values.isMissing(value)) {
            return null;
        }
        if (DataTypes.LongType.equals(type)) {
            return ((Number) value).longValue();
        }
        if (DataTypes.DoubleType.equals(type)) {
            return ((Number) value).doubleValue();
        }
        if (DataTypes.BooleanType.equals(type)) {
            return value;
        }
        return String.valueOf(value);
    }
}
