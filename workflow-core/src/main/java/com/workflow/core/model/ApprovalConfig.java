package com.workflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of an APPROVAL step.
 *
 * @param approverId who must approve or reject
 * @param parameters extra data passed along with the approver notification
 */
public record ApprovalConfig(String approverId, Map<String, Object> parameters) implements StepConfig {

    public static final String APPROVER_ID_KEY = "approverId";

    public ApprovalConfig {
        parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static ApprovalConfig of(String approverId) {
        return new ApprovalConfig(approverId, Map.of());
    }

    @Override
    public StepKind kind() {
        return StepKind.APPROVAL;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(parameters);
        map.put(APPROVER_ID_KEY, approverId);
        return map;
    }
}
