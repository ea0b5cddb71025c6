package com.workflow.examples.purchase;

import com.workflow.core.model.ActionConfig;
import com.workflow.core.model.Condition;
import com.workflow.core.model.ConditionOperator;
import com.workflow.core.model.ErrorHandlingPolicy;
import com.workflow.core.model.OnError;
import com.workflow.core.model.StepKind;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowStep;

import java.util.Map;

/**
 * Purchase order approval workflow.
 *
 * <pre>
 * validate_order
 *   -> check_amount (amount > threshold)
 *        true:  manager_approval -> reserve_budget
 *        false: reserve_budget
 *   -> fulfilment_wait (delay)
 *   -> notify_requester
 * </pre>
 */
public final class PurchaseOrderWorkflow {

    public static final String WORKFLOW_ID = "purchase-order";

    public static final String VALIDATE_ORDER = "validate_order";
    public static final String CHECK_AMOUNT = "check_amount";
    public static final String MANAGER_APPROVAL = "manager_approval";
    public static final String RESERVE_BUDGET = "reserve_budget";
    public static final String FULFILMENT_WAIT = "fulfilment_wait";
    public static final String NOTIFY_REQUESTER = "notify_requester";

    public static final String VALIDATE_ACTION = "validate_order";
    public static final String RESERVE_ACTION = "reserve_budget";

    public static final String APPROVER = "finance-manager";

    private PurchaseOrderWorkflow() {
    }

    /**
     * @param approvalThreshold orders above this amount need a manager's approval
     * @param fulfilmentDelaySeconds wait between budget reservation and notification
     */
    public static WorkflowDefinition definition(double approvalThreshold, long fulfilmentDelaySeconds) {
        return WorkflowDefinition.builder()
            .id(WORKFLOW_ID)
            .name("Purchase order approval")
            .description("Validates a purchase order, gates large amounts on a manager, reserves budget")
            .steps(
                WorkflowStep.builder()
                    .id(VALIDATE_ORDER)
                    .name("Validate order")
                    .kind(StepKind.ACTION)
                    .config(ActionConfig.of(VALIDATE_ACTION))
                    .nextSteps(CHECK_AMOUNT)
                    .errorHandling(ErrorHandlingPolicy.of(0, 0, OnError.STOP))
                    .build(),
                WorkflowStep.condition(CHECK_AMOUNT,
                    Condition.of("amount", ConditionOperator.GREATER_THAN, approvalThreshold),
                    MANAGER_APPROVAL, RESERVE_BUDGET),
                WorkflowStep.approval(MANAGER_APPROVAL, APPROVER, RESERVE_BUDGET),
                WorkflowStep.builder()
                    .id(RESERVE_BUDGET)
                    .name("Reserve budget")
                    .kind(StepKind.ACTION)
                    .config(ActionConfig.of(RESERVE_ACTION))
                    .nextSteps(FULFILMENT_WAIT)
                    .errorHandling(new ErrorHandlingPolicy(3, 1, 2.0, 10, OnError.STOP))
                    .build(),
                WorkflowStep.delay(FULFILMENT_WAIT, fulfilmentDelaySeconds, NOTIFY_REQUESTER),
                WorkflowStep.notification(NOTIFY_REQUESTER, Map.of(
                    "channel", "email",
                    "template", "purchase-order-ready")))
            .build();
    }
}
