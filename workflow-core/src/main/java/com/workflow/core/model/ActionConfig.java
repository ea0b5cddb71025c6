package com.workflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of an ACTION step.
 *
 * @param action     name of the registered handler to invoke
 * @param parameters remaining handler parameters
 */
public record ActionConfig(String action, Map<String, Object> parameters) implements StepConfig {

    public static final String ACTION_KEY = "action";

    public ActionConfig {
        parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static ActionConfig of(String action) {
        return new ActionConfig(action, Map.of());
    }

    @Override
    public StepKind kind() {
        return StepKind.ACTION;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(parameters);
        map.put(ACTION_KEY, action);
        return map;
    }
}
