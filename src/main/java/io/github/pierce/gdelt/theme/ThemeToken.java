package io.github.pierce.gdelt.theme;

/**
 * One {@code label[,magnitude]} entry of a theme cell.
 *
 * @param label     theme label, never blank
 * @param magnitude {@link Long}, {@link Double} or raw {@link String}; null when the cell carried none
 */
public record ThemeToken(String label, Object magnitude) {

    public ThemeToken {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Theme label must not be blank");
        }
    }

    public static ThemeToken of(String label) {
        return new ThemeToken(label, null);
    }

    public boolean hasMagnitude() {
        return magnitude != null;
    }
}
