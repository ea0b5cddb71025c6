package com.workflow.engine.executor;

import com.workflow.core.model.ApprovalRequest;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the step loop does after a successful dispatch.
 *
 * @param type            advance, wait for a delay, or wait for an approval
 * @param nextStepId      step to advance to; null completes the execution (ADVANCE only)
 * @param contextUpdates  entries merged into the execution context
 * @param delay           how long to wait (DELAY only)
 * @param approvalRequest the pending request (AWAIT_APPROVAL only)
 */
public record StepOutcome(
    Type type,
    String nextStepId,
    Map<String, Object> contextUpdates,
    Duration delay,
    ApprovalRequest approvalRequest
) {
    public enum Type {
        ADVANCE,
        DELAY,
        AWAIT_APPROVAL
    }

    public StepOutcome {
        contextUpdates = contextUpdates != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(contextUpdates)) : Map.of();
    }

    public static StepOutcome advance(String nextStepId) {
        return new StepOutcome(Type.ADVANCE, nextStepId, Map.of(), null, null);
    }

    public static StepOutcome advance(String nextStepId, Map<String, Object> contextUpdates) {
        return new StepOutcome(Type.ADVANCE, nextStepId, contextUpdates, null, null);
    }

    public static StepOutcome delay(Duration delay) {
        return new StepOutcome(Type.DELAY, null, Map.of(), delay, null);
    }

    public static StepOutcome awaitApproval(ApprovalRequest request) {
        return new StepOutcome(Type.AWAIT_APPROVAL, null, Map.of(), null, request);
    }

    public boolean suspends() {
        return type != Type.ADVANCE;
    }
}
