package com.workflow.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single comparison of a context field against a literal.
 *
 * @param field    dot-separated path into the execution context
 * @param operator comparison to apply
 * @param value    literal to compare against, may be null
 */
public record Condition(String field, ConditionOperator operator, Object value) {

    public static Condition of(String field, ConditionOperator operator, Object value) {
        return new Condition(field, operator, value);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", field);
        map.put("operator", operator.wireName());
        map.put("value", value);
        return map;
    }
}
