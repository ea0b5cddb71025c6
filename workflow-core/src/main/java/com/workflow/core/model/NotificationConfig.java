package com.workflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of a NOTIFICATION step.
 *
 * @param handler    name of the notification handler, {@link #DEFAULT_HANDLER} when unset
 * @param parameters message, channel, recipients and so on
 */
public record NotificationConfig(String handler, Map<String, Object> parameters) implements StepConfig {

    public static final String HANDLER_KEY = "handler";
    public static final String DEFAULT_HANDLER = "notification";

    public NotificationConfig {
        handler = handler != null && !handler.isBlank() ? handler : DEFAULT_HANDLER;
        parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static NotificationConfig of(Map<String, Object> parameters) {
        return new NotificationConfig(DEFAULT_HANDLER, parameters);
    }

    @Override
    public StepKind kind() {
        return StepKind.NOTIFICATION;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(parameters);
        map.put(HANDLER_KEY, handler);
        return map;
    }
}
