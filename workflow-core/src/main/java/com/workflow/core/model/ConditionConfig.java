package com.workflow.core.model;

import java.util.Map;

/**
 * Configuration of a CONDITION step.
 */
public record ConditionConfig(Condition condition) implements StepConfig {

    public static final String CONDITION_KEY = "condition";

    @Override
    public StepKind kind() {
        return StepKind.CONDITION;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of(CONDITION_KEY, condition.toMap());
    }
}
