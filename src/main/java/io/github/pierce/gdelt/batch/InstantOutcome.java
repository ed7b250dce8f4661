package io.github.pierce.gdelt.batch;

/**
 * Result of running one instant: the produced {@link InstantResult}, the failure, or a
 * cancellation before it started.
 */
public final class InstantOutcome {

    private final String timestamp;
    private final InstantState state;
    private final InstantResult result;
    private final Throwable error;

    private InstantOutcome(String timestamp, InstantState state, InstantResult result, Throwable error) {
        this.timestamp = timestamp;
        this.state = state;
        this.result = result;
        this.error = error;
    }

    public static InstantOutcome success(InstantResult result) {
        return new InstantOutcome(result.timestamp(), InstantState.SUCCEEDED, result, null);
    }

    public static InstantOutcome failure(String timestamp, Throwable error) {
        return new InstantOutcome(timestamp, InstantState.FAILED, null, error);
    }

    public static InstantOutcome cancelled(String timestamp) {
        return new InstantOutcome(timestamp, InstantState.CANCELLED, null, null);
    }

    public String getTimestamp() {
        return timestamp;
    }

    public InstantState getState() {
        return state;
    }

    public boolean isSuccess() {
        return state == InstantState.SUCCEEDED;
    }

    public InstantResult getResult() {
        return result;
    }

    public Throwable getError() {
        return error;
    }

    /**
     * {@code "<ExceptionSimpleName>: <message>"}, or null when the instant did not fail.
     */
    public String formatError() {
        if (error == null) {
            return null;
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
