package com.dataflywheel.job;

import java.time.Duration;

import com.dataflywheel.runtime.AppConfig;

public record ControllerSettings(String baselineModel, Duration fetchTimeout, int maxConcurrentCandidates) {

    public static ControllerSettings from(AppConfig config) {
        return new ControllerSettings(
                config.getServing().getBaselineModel(),
                Duration.ofMillis(config.getOrchestrator().getFetchTimeoutMs()),
                config.getOrchestrator().getMaxConcurrentCandidates());
    }
}
