package com.dataflywheel.evaluation;

import java.time.Duration;

import com.dataflywheel.runtime.AppConfig;

public record EvaluationSettings(
        int maxRetries,
        Duration retryBackoff,
        Duration callTimeout,
        int unavailableAfterSkips) {

    public static EvaluationSettings from(AppConfig.EvaluationConfig config) {
        return new EvaluationSettings(
                config.getMaxRetries(),
                Duration.ofMillis(config.getRetryBackoffMs()),
                Duration.ofMillis(config.getCallTimeoutMs()),
                config.getUnavailableAfterSkips());
    }
}
