package com.workflow.engine.condition;

import com.workflow.core.model.Condition;
import com.workflow.core.model.ConditionOperator;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a {@link Condition} against an execution context.
 * Stateless and thread-safe.
 *
 * Semantics:
 * - field is a dot-separated path through nested maps (list elements by index)
 * - a missing field is undefined: every operator yields false except not_equals
 * - numbers compare by value regardless of type; a numeric string compared
 *   with a number is read as a number
 * - two strings compare lexicographically for greater_than / less_than
 * - contains checks collection membership, otherwise substring of the text form
 */
public class ConditionEvaluator {

    private static final Object UNDEFINED = new Object();

    public boolean evaluate(Condition condition, Map<String, Object> context) {
        Object actual = resolve(context, condition.field());
        if (actual == UNDEFINED) {
            return condition.operator() == ConditionOperator.NOT_EQUALS;
        }

        Object expected = condition.value();

        return switch (condition.operator()) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case GREATER_THAN -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case CONTAINS -> contains(actual, expected);
        };
    }

    /**
     * Check whether a dot-path resolves to a value (possibly null) in the context.
     */
    public boolean isDefined(Map<String, Object> context, String path) {
        return resolve(context, path) != UNDEFINED;
    }

    // ========== Internal Methods ==========

    private static Object resolve(Map<String, Object> context, String path) {
        if (context == null || path == null || path.isEmpty()) {
            return UNDEFINED;
        }

        Object current = context;
        for (String key : path.split("\\.")) {
            if (current instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) current;
                if (!map.containsKey(key)) {
                    return UNDEFINED;
                }
                current = map.get(key);
            } else if (current instanceof List) {
                List<?> list = (List<?>) current;
                int index = parseIndex(key);
                if (index < 0 || index >= list.size()) {
                    return UNDEFINED;
                }
                current = list.get(index);
            } else {
                return UNDEFINED;
            }
        }
        return current;
    }

    private static int parseIndex(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        Optional<Integer> numeric = compareNumeric(actual, expected);
        if (numeric.isPresent()) {
            return numeric.get() == 0;
        }
        return Objects.equals(actual, expected);
    }

    @SuppressWarnings("unchecked")
    private static Optional<Integer> compare(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return Optional.empty();
        }
        Optional<Integer> numeric = compareNumeric(actual, expected);
        if (numeric.isPresent()) {
            return numeric;
        }
        if (actual instanceof String && expected instanceof String) {
            return Optional.of(((String) actual).compareTo((String) expected));
        }
        if (actual instanceof Comparable && actual.getClass().equals(expected.getClass())) {
            return Optional.of(((Comparable<Object>) actual).compareTo(expected));
        }
        return Optional.empty();
    }

    /**
     * Numeric comparison when at least one side is a number and the other reads as one.
     */
    private static Optional<Integer> compareNumeric(Object actual, Object expected) {
        if (!(actual instanceof Number) && !(expected instanceof Number)) {
            return Optional.empty();
        }
        BigDecimal a = toDecimal(actual);
        BigDecimal e = toDecimal(expected);
        if (a == null || e == null) {
            return Optional.empty();
        }
        return Optional.of(a.compareTo(e));
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).stream().anyMatch(element -> valuesEqual(element, expected));
        }
        if (actual instanceof Map) {
            return ((Map<?, ?>) actual).containsKey(expected);
        }
        return String.valueOf(actual).contains(String.valueOf(expected));
    }
}
