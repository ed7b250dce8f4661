package io.github.pierce.gdelt.batch;

/**
 * Terminal state of one processing instant within a batch run.
 */
public enum InstantState {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
