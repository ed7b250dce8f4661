package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.quality.MappingQualityConfig;

import java.util.List;
import java.util.Objects;

/**
 * One batch run: a base instant whose timestamp is replaced for every instant of the range.
 *
 * <p>Immutable; use {@link #builder(ProcessingInstant)}.</p>
 */
public final class BatchRequest {

    private final ProcessingInstant baseInstant;
    private final MappingQualityConfig mappingQuality;
    private final String timestampStart;
    private final String timestampEnd;
    private final OnErrorPolicy onError;
    private final ReturnMode returnMode;
    private final boolean flattenMappingTables;
    private final int parallelism;

    private BatchRequest(Builder builder) {
        this.baseInstant = builder.baseInstant;
        this.mappingQuality = builder.mappingQuality;
        this.timestampStart = builder.timestampStart;
        this.timestampEnd = builder.timestampEnd;
        this.onError = builder.onError;
        this.returnMode = builder.returnMode;
        this.flattenMappingTables = builder.flattenMappingTables;
        this.parallelism = builder.parallelism;
    }

    public static Builder builder(ProcessingInstant baseInstant) {
        return new Builder(baseInstant);
    }

    /**
     * Timestamps this request covers. A blank start falls back to the base instant's timestamp.
     *
     * @throws ValidationException if neither is set, or the range is invalid
     */
    public List<String> timestamps() {
        if (timestampStart == null || timestampStart.isBlank()) {
            String base = baseInstant.timestamp();
            if (base == null || base.isBlank()) {
                throw new ValidationException("Provide timestamp_start or set the base instant timestamp");
            }
            return TimestampRangeExpander.expand(base, null);
        }
        return TimestampRangeExpander.expand(timestampStart.strip(), timestampEnd);
    }

    public ProcessingInstant getBaseInstant() {
        return baseInstant;
    }

    public MappingQualityConfig getMappingQuality() {
        return mappingQuality;
    }

    public String getTimestampStart() {
        return timestampStart;
    }

    public String getTimestampEnd() {
        return timestampEnd;
    }

    public OnErrorPolicy getOnError() {
        return onError;
    }

    public ReturnMode getReturnMode() {
        return returnMode;
    }

    public boolean isFlattenMappingTables() {
        return flattenMappingTables;
    }

    public int getParallelism() {
        return parallelism;
    }

    public static final class Builder {
        private final ProcessingInstant baseInstant;
        private MappingQualityConfig mappingQuality;
        private String timestampStart;
        private String timestampEnd;
        private OnErrorPolicy onError = OnErrorPolicy.RAISE;
        private ReturnMode returnMode = ReturnMode.STRUCTURED;
        private boolean flattenMappingTables = true;
        private int parallelism = 1;

        private Builder(ProcessingInstant baseInstant) {
            this.baseInstant = Objects.requireNonNull(baseInstant, "baseInstant");
        }

        public Builder mappingQuality(MappingQualityConfig config) {
            this.mappingQuality = config;
            return this;
        }

        public Builder timestampStart(String start) {
            this.timestampStart = start;
            return this;
        }

        public Builder timestampEnd(String end) {
            this.timestampEnd = end;
            return this;
        }

        public Builder range(String start, String end) {
            return timestampStart(start).timestampEnd(end);
        }

        public Builder onError(OnErrorPolicy policy) {
            this.onError = Objects.requireNonNull(policy, "onError");
            return this;
        }

        public Builder returnMode(ReturnMode mode) {
            this.returnMode = Objects.requireNonNull(mode, "returnMode");
            return this;
        }

        public Builder flattenMappingTables(boolean flatten) {
            this.flattenMappingTables = flatten;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new ValidationException("Parallelism must be at least 1, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(this);
        }
    }
}
