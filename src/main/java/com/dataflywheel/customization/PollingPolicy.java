package com.dataflywheel.customization;

import java.time.Duration;

import com.dataflywheel.runtime.AppConfig;

public record PollingPolicy(
        Duration initialBackoff,
        Duration maxBackoff,
        Duration deadline,
        Duration submitTimeout,
        Duration pollTimeout) {

    public PollingPolicy {
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("poll initial backoff must be > 0, was " + initialBackoff);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("poll max backoff must be >= initial backoff");
        }
    }

    public static PollingPolicy from(AppConfig.CustomizationConfig config) {
        return new PollingPolicy(
                Duration.ofMillis(config.getPollInitialBackoffMs()),
                Duration.ofMillis(config.getPollMaxBackoffMs()),
                Duration.ofMillis(config.getDeadlineMs()),
                Duration.ofMillis(config.getSubmitTimeoutMs()),
                Duration.ofMillis(config.getPollTimeoutMs()));
    }

    Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
    }
}
