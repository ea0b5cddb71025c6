package com.workflow.examples.purchase;

import com.workflow.core.exception.DefinitionNotFoundException;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.engine.analytics.WorkflowAnalyticsService;
import com.workflow.engine.approval.ApprovalGateManager;
import com.workflow.engine.coordinator.ExecutionCoordinator;
import com.workflow.engine.definition.WorkflowDefinitionService;
import com.workflow.handler.StepHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PurchaseOrderProperties.class)
public class PurchaseOrderConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PurchaseOrderConfiguration.class);

    @Bean
    public PurchaseOrderHandlers purchaseOrderHandlers(StepHandlerRegistry registry, PurchaseOrderProperties properties) {
        PurchaseOrderHandlers handlers = new PurchaseOrderHandlers(properties.getBudgetFailuresBeforeSuccess());
        handlers.registerWith(registry);
        return handlers;
    }

    /**
     * The active purchase order definition, registered on first start.
     */
    @Bean
    public WorkflowDefinition purchaseOrderDefinition(
            WorkflowDefinitionService definitionService,
            PurchaseOrderProperties properties) {
        WorkflowDefinition definition;
        try {
            definition = definitionService.get(PurchaseOrderWorkflow.WORKFLOW_ID);
        } catch (DefinitionNotFoundException e) {
            definition = definitionService.create(PurchaseOrderWorkflow.definition(
                properties.getApprovalThreshold(), properties.getFulfilmentDelaySeconds()));
            log.info("Registered workflow {} version {}", definition.id(), definition.version());
        }
        return definition.isActive() ? definition : definitionService.activate(definition.id());
    }

    @Bean
    @ConditionalOnProperty(prefix = "purchase-order", name = "demo-enabled", matchIfMissing = true)
    public PurchaseOrderDemo purchaseOrderDemo(
            ExecutionCoordinator coordinator,
            ApprovalGateManager approvalGate,
            WorkflowAnalyticsService analytics,
            WorkflowDefinition purchaseOrderDefinition) {
        return new PurchaseOrderDemo(coordinator, approvalGate, analytics, purchaseOrderDefinition);
    }
}
