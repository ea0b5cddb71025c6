package com.workflow.engine.condition;

import com.workflow.core.model.Condition;
import com.workflow.core.model.ConditionOperator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.workflow.core.model.ConditionOperator.*;
import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private boolean eval(String field, ConditionOperator operator, Object value, Map<String, Object> context) {
        return evaluator.evaluate(Condition.of(field, operator, value), context);
    }

    @Test
    void greaterThan_shouldCompareNumbersAcrossTypes() {
        assertTrue(eval("amount", GREATER_THAN, 100, Map.of("amount", 150)));
        assertTrue(eval("amount", GREATER_THAN, 100, Map.of("amount", 100.5)));
        assertTrue(eval("amount", GREATER_THAN, 100L, Map.of("amount", new BigDecimal("100.01"))));
        assertFalse(eval("amount", GREATER_THAN, 100, Map.of("amount", 100)));
        assertFalse(eval("amount", GREATER_THAN, 100, Map.of("amount", 50)));
    }

    @Test
    void lessThan_shouldCompareNumbers() {
        assertTrue(eval("amount", LESS_THAN, 100, Map.of("amount", 99)));
        assertFalse(eval("amount", LESS_THAN, 100, Map.of("amount", 100.0)));
    }

    @Test
    void equals_shouldTreatIntegerAndDoubleAsSameValue() {
        assertTrue(eval("amount", EQUALS, 100, Map.of("amount", 100.0)));
        assertFalse(eval("amount", NOT_EQUALS, 100, Map.of("amount", 100.0)));
    }

    @Test
    void numericString_shouldCompareAsNumber() {
        assertTrue(eval("amount", GREATER_THAN, 100, Map.of("amount", "250")));
        assertTrue(eval("amount", EQUALS, "42", Map.of("amount", 42)));
    }

    @Test
    void strings_shouldCompareLexicographically() {
        assertTrue(eval("name", GREATER_THAN, "alice", Map.of("name", "bob")));
        assertTrue(eval("name", LESS_THAN, "bob", Map.of("name", "alice")));
        assertTrue(eval("status", EQUALS, "approved", Map.of("status", "approved")));
        assertFalse(eval("status", EQUALS, "Approved", Map.of("status", "approved")));
    }

    @Test
    void sameTypeComparables_shouldCompareNaturally() {
        LocalDate due = LocalDate.of(2024, 5, 1);
        assertTrue(eval("shipBy", GREATER_THAN, LocalDate.of(2024, 4, 30), Map.of("shipBy", due)));
        assertTrue(eval("shipBy", LESS_THAN, LocalDate.of(2024, 5, 2), Map.of("shipBy", due)));
        assertFalse(eval("shipBy", LESS_THAN, "2024-06-01", Map.of("shipBy", due)));
    }

    @Test
    void incomparableTypes_shouldBeFalse() {
        assertFalse(eval("amount", GREATER_THAN, 100, Map.of("amount", "lots")));
        assertFalse(eval("flag", LESS_THAN, "x", Map.of("flag", true)));
    }

    @Test
    void booleans_shouldCompareByEquality() {
        assertTrue(eval("valid", EQUALS, true, Map.of("valid", true)));
        assertTrue(eval("valid", NOT_EQUALS, true, Map.of("valid", false)));
    }

    @Test
    void missingField_shouldOnlySatisfyNotEquals() {
        Map<String, Object> context = Map.of("other", 1);

        assertFalse(eval("amount", EQUALS, 100, context));
        assertFalse(eval("amount", GREATER_THAN, 100, context));
        assertFalse(eval("amount", LESS_THAN, 100, context));
        assertFalse(eval("amount", CONTAINS, 100, context));
        assertTrue(eval("amount", NOT_EQUALS, 100, context));
    }

    @Test
    void nullValue_shouldBeDefinedButOnlyEqualToNull() {
        Map<String, Object> context = new HashMap<>();
        context.put("approver", null);

        assertTrue(evaluator.isDefined(context, "approver"));
        assertTrue(eval("approver", EQUALS, null, context));
        assertFalse(eval("approver", EQUALS, "u1", context));
        assertFalse(eval("approver", GREATER_THAN, 1, context));
    }

    @Test
    void dottedPath_shouldResolveNestedMapsAndListIndexes() {
        Map<String, Object> context = Map.of(
            "order", Map.of(
                "customer", Map.of("tier", "gold"),
                "items", List.of(Map.of("sku", "A-1"), Map.of("sku", "B-2"))
            )
        );

        assertTrue(eval("order.customer.tier", EQUALS, "gold", context));
        assertTrue(eval("order.items.1.sku", EQUALS, "B-2", context));
        assertFalse(evaluator.isDefined(context, "order.items.5.sku"));
        assertFalse(evaluator.isDefined(context, "order.customer.tier.level"));
    }

    @Test
    void contains_shouldCheckMembershipOrSubstring() {
        assertTrue(eval("tags", CONTAINS, "urgent", Map.of("tags", List.of("urgent", "finance"))));
        assertFalse(eval("tags", CONTAINS, "hr", Map.of("tags", List.of("urgent", "finance"))));
        assertTrue(eval("ids", CONTAINS, 2, Map.of("ids", List.of(1L, 2L, 3L))));
        assertTrue(eval("email", CONTAINS, "@example.com", Map.of("email", "a@example.com")));
        assertTrue(eval("headers", CONTAINS, "X-Trace", Map.of("headers", Map.of("X-Trace", "1"))));
    }

    @Test
    void emptyOrNullContext_shouldTreatFieldAsMissing() {
        assertFalse(eval("amount", EQUALS, 1, Map.of()));
        assertTrue(eval("amount", NOT_EQUALS, 1, null));
    }
}
