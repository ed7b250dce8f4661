package io.github.pierce.gdelt;

import io.github.pierce.gdelt.batch.BatchResult;

/**
 * Thrown under the fail-fast policy when an instant fails. Carries the instant's error as
 * its cause and everything the run had produced before it.
 */
public class BatchAbortedException extends GdeltProcessingException {

    private final transient BatchResult partialResult;

    public BatchAbortedException(String timestamp, Throwable cause, BatchResult partialResult) {
        super(timestamp, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        this.partialResult = partialResult;
    }

    public BatchResult getPartialResult() {
        return partialResult;
    }
}
