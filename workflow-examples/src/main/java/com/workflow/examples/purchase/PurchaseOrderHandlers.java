package com.workflow.examples.purchase;

import com.workflow.core.model.NotificationConfig;
import com.workflow.handler.StepHandlerContext;
import com.workflow.handler.StepHandlerException;
import com.workflow.handler.StepHandlerRegistry;
import com.workflow.handler.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated handlers for the purchase order workflow.
 *
 * Budget reservation is idempotent on the step's idempotency key, so a retried
 * attempt returns the reference of the first successful one. It can be told to
 * fail a number of times first to show retries with backoff.
 */
public class PurchaseOrderHandlers {

    private static final Logger log = LoggerFactory.getLogger(PurchaseOrderHandlers.class);

    private final int budgetFailuresBeforeSuccess;
    private final AtomicInteger budgetAttempts = new AtomicInteger();
    private final Map<String, String> reservations = new ConcurrentHashMap<>();
    private final List<String> sentNotifications = new CopyOnWriteArrayList<>();

    public PurchaseOrderHandlers(int budgetFailuresBeforeSuccess) {
        this.budgetFailuresBeforeSuccess = budgetFailuresBeforeSuccess;
    }

    public void registerWith(StepHandlerRegistry registry) {
        registry
            .register(PurchaseOrderWorkflow.VALIDATE_ACTION, this::validateOrder)
            .register(PurchaseOrderWorkflow.RESERVE_ACTION, this::reserveBudget)
            .register(NotificationConfig.DEFAULT_HANDLER, this::notifyRequester);
    }

    StepResult validateOrder(StepHandlerContext context) throws StepHandlerException {
        Map<String, Object> order = context.getExecutionContext();
        Object amount = order.get("amount");
        Object requester = order.get("requester");

        if (!(amount instanceof Number) || ((Number) amount).doubleValue() <= 0) {
            throw StepHandlerException.permanent("INVALID_ORDER", "Order amount must be a positive number: " + amount);
        }
        if (requester == null || requester.toString().isBlank()) {
            throw StepHandlerException.permanent("INVALID_ORDER", "Order has no requester");
        }

        log.info("[{}] Order from {} for {} validated", context.getIdempotencyKey(), requester, amount);
        return StepResult.success(Map.of("validated", true));
    }

    StepResult reserveBudget(StepHandlerContext context) throws StepHandlerException {
        String key = context.getIdempotencyKey();
        String existing = reservations.get(key);
        if (existing != null) {
            log.info("[{}] Budget already reserved: {}", key, existing);
            return StepResult.success(Map.of("budgetReference", existing));
        }

        int attempt = budgetAttempts.incrementAndGet();
        if (attempt <= budgetFailuresBeforeSuccess) {
            log.warn("[{}] Budget service unavailable (attempt {})", key, context.getAttemptNumber());
            throw StepHandlerException.transientFailure("BUDGET_UNAVAILABLE", "Budget service unavailable");
        }

        String reference = "BUD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        reservations.put(key, reference);
        log.info("[{}] Reserved {} for order of {}", key, reference, context.getExecutionContext().get("amount"));
        return StepResult.success(Map.of("budgetReference", reference));
    }

    StepResult notifyRequester(StepHandlerContext context) {
        Map<String, Object> order = context.getExecutionContext();
        String message = String.format("Purchase order %s of %s is ready (budget %s)",
            context.getExecutionId(), order.get("amount"), order.get("budgetReference"));

        log.info("Notifying {} via {}: {}", order.get("requester"), context.getParameters().get("channel"), message);
        sentNotifications.add(message);
        return StepResult.success();
    }

    public List<String> sentNotifications() {
        return List.copyOf(sentNotifications);
    }

    public int budgetAttempts() {
        return budgetAttempts.get();
    }
}
