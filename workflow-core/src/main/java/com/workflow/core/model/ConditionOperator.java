package com.workflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators of a condition step.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    CONTAINS("contains");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConditionOperator fromWireName(String name) {
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equalsIgnoreCase(name) || operator.name().equalsIgnoreCase(name)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + name);
    }
}
