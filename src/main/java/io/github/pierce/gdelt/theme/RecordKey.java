package io.github.pierce.gdelt.theme;

/**
 * Composite key identifying one logical GKG record across theme schema versions.
 * Not guaranteed to be unique within a file.
 */
public record RecordKey(Object recordId, Object documentIdentifier) {
}
