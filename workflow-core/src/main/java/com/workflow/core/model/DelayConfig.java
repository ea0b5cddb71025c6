package com.workflow.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration of a DELAY step.
 */
public record DelayConfig(long delaySeconds) implements StepConfig {

    public static final String DELAY_SECONDS_KEY = "delaySeconds";

    public static DelayConfig ofSeconds(long delaySeconds) {
        return new DelayConfig(delaySeconds);
    }

    public Duration delay() {
        return Duration.ofSeconds(delaySeconds);
    }

    @Override
    public StepKind kind() {
        return StepKind.DELAY;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of(DELAY_SECONDS_KEY, delaySeconds);
    }
}
