package com.workflow.core.model;

import com.workflow.core.exception.WorkflowValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between typed step configurations and the key-value form
 * kept in storage. Validation of untyped input happens here and nowhere else.
 */
public final class StepConfigs {

    private StepConfigs() {
    }

    /**
     * Parse and validate an untyped configuration map for the given step kind.
     *
     * @throws WorkflowValidationException if required keys are missing or malformed
     */
    public static StepConfig fromMap(StepKind kind, Map<String, Object> raw) {
        Map<String, Object> map = raw != null ? new LinkedHashMap<>(raw) : new LinkedHashMap<>();

        return switch (kind) {
            case ACTION -> {
                Object action = map.remove(ActionConfig.ACTION_KEY);
                if (!(action instanceof String) || ((String) action).isBlank()) {
                    throw new WorkflowValidationException("config.action", "action step requires a handler name");
                }
                yield new ActionConfig((String) action, map);
            }
            case CONDITION -> new ConditionConfig(parseCondition(map.get(ConditionConfig.CONDITION_KEY)));
            case DELAY -> {
                Object delay = map.containsKey(DelayConfig.DELAY_SECONDS_KEY)
                    ? map.get(DelayConfig.DELAY_SECONDS_KEY)
                    : map.get("delay");
                yield new DelayConfig(toLong("config.delaySeconds", delay));
            }
            case APPROVAL -> {
                Object approverId = map.remove(ApprovalConfig.APPROVER_ID_KEY);
                if (approverId == null || approverId.toString().isBlank()) {
                    throw new WorkflowValidationException("config.approverId", "approval step requires an approver");
                }
                yield new ApprovalConfig(approverId.toString(), map);
            }
            case NOTIFICATION -> {
                Object handler = map.remove(NotificationConfig.HANDLER_KEY);
                yield new NotificationConfig(handler != null ? handler.toString() : null, map);
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static Condition parseCondition(Object raw) {
        if (!(raw instanceof Map)) {
            throw new WorkflowValidationException("config.condition", "condition step requires a condition object");
        }
        Map<String, Object> condition = (Map<String, Object>) raw;

        Object field = condition.get("field");
        if (field == null || field.toString().isBlank()) {
            throw new WorkflowValidationException("config.condition.field", "cannot be empty");
        }

        Object operator = condition.get("operator");
        if (operator == null) {
            throw new WorkflowValidationException("config.condition.operator", "cannot be empty");
        }

        ConditionOperator parsed;
        try {
            parsed = ConditionOperator.fromWireName(operator.toString());
        } catch (IllegalArgumentException e) {
            throw new WorkflowValidationException("config.condition.operator", e.getMessage());
        }

        return new Condition(field.toString(), parsed, condition.get("value"));
    }

    private static long toLong(String field, Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new WorkflowValidationException(field, "not a number: " + value);
            }
        }
        throw new WorkflowValidationException(field, "is required");
    }
}
