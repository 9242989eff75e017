package com.dataflywheel.records;

public record TimeRange(Long fromEpochSeconds, Long toEpochSeconds) {
    public static final TimeRange ALL = new TimeRange(null, null);

    public TimeRange {
        if (fromEpochSeconds != null && toEpochSeconds != null && fromEpochSeconds > toEpochSeconds) {
            throw new IllegalArgumentException("time range start must not be after its end");
        }
    }

    public boolean contains(long epochSeconds) {
        return (fromEpochSeconds == null || epochSeconds >= fromEpochSeconds)
                && (toEpochSeconds == null || epochSeconds <= toEpochSeconds);
    }
}
