package io.github.pierce.gdelt.theme;

import io.github.pierce.gdelt.table.Values;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses GKG theme cells such as {@code EPU_ECONOMY_HISTORIC,582;TAX_FNCACT,1204}.
 *
 * <p>The parser is total: any input yields a (possibly empty) list. Tokens are separated
 * by {@code ;}, the label and its magnitude by {@code ,}. Magnitudes are read as an
 * integer first ({@link Long}, or {@link BigInteger} past the long range), then as a
 * floating point number ({@link Double}), and are otherwise kept as the raw string.</p>
 */
public final class ThemeCellParser {

    public static final String TOKEN_SEPARATOR = ";";
    public static final String FIELD_SEPARATOR = ",";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ThemeCellParser() {
    }

    public static List<ThemeToken> parse(Object cell) {
        if (Values.isMissing(cell)) {
            return List.of();
        }
        String text = String.valueOf(cell).strip();
        if (text.isEmpty()) {
            return List.of();
        }

        List<ThemeToken> tokens = new ArrayList<>();
        for (String rawToken : text.split(TOKEN_SEPARATOR, -1)) {
            String token = rawToken.strip();
            if (token.isEmpty()) {
                continue;
            }
            String[] parts = token.split(FIELD_SEPARATOR, -1);
            String label = parts[0].strip();
            if (label.isEmpty()) {
                continue;
            }
            Object magnitude = null;
            if (parts.length >= 2) {
                String raw = parts[1].strip();
                if (!raw.isEmpty()) {
                    magnitude = parseMagnitude(raw);
                }
            }
            tokens.add(new ThemeToken(label, magnitude));
        }
        return tokens;
    }

    /**
     * Integer, then float, then the raw string. Never throws.
     */
    static Object parseMagnitude(String raw) {
        if (INTEGER.matcher(raw).matches()) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                return new BigInteger(raw);
            }
        }
        if (DECIMAL.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "inf", "+inf", "infinity", "+infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf", "-infinity":
                return Double.NEGATIVE_INFINITY;
            case "nan", "+nan", "-nan":
                return Double.NaN;
            default:
                return raw;
        }
    }

    /**
     * Labels of a parsed cell, in cell order, duplicates kept.
     */
    public static List<String> labels(List<ThemeToken> tokens) {
        List<String> labels = new ArrayList<>(tokens.size());
        for (ThemeToken token : tokens) {
            labels.add(token.label());
        }
        return labels;
    }

    /**
     * Non-null magnitudes of a parsed cell, in cell order.
     */
    public static List<Object> magnitudes(List<ThemeToken> tokens) {
        List<Object> magnitudes = new ArrayList<>();
        for (ThemeToken token : tokens) {
            if (token.hasMagnitude()) {
                magnitudes.add(token.magnitude());
            }
        }
        return magnitudes;
    }
}
