package com.workflow.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a handler invocation.
 *
 * @param succeeded      whether the step succeeded
 * @param contextUpdates entries merged into the execution context on success
 * @param error          failure message, null on success
 * @param retryable      whether a failure may be retried
 */
public record StepResult(
    boolean succeeded,
    Map<String, Object> contextUpdates,
    String error,
    boolean retryable
) {
    public StepResult {
        contextUpdates = contextUpdates != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(contextUpdates)) : Map.of();
    }

    public static StepResult success() {
        return new StepResult(true, Map.of(), null, false);
    }

    public static StepResult success(Map<String, Object> contextUpdates) {
        return new StepResult(true, contextUpdates, null, false);
    }

    public static StepResult failure(String error) {
        return new StepResult(false, Map.of(), error, true);
    }

    public static StepResult permanentFailure(String error) {
        return new StepResult(false, Map.of(), error, false);
    }
}
