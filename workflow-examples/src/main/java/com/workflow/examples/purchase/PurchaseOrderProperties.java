package com.workflow.examples.purchase;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code purchase-order.*}.
 */
@ConfigurationProperties(prefix = "purchase-order")
public class PurchaseOrderProperties {

    /**
     * Orders above this amount wait for the finance manager.
     */
    private double approvalThreshold = 1000;

    private long fulfilmentDelaySeconds = 2;

    /**
     * Simulated budget service outages before the first successful reservation.
     */
    private int budgetFailuresBeforeSuccess = 0;

    private boolean demoEnabled = true;

    public double getApprovalThreshold() {
        return approvalThreshold;
    }

    public void setApprovalThreshold(double approvalThreshold) {
        this.approvalThreshold = approvalThreshold;
    }

    public long getFulfilmentDelaySeconds() {
        return fulfilmentDelaySeconds;
    }

    public void setFulfilmentDelaySeconds(long fulfilmentDelaySeconds) {
        this.fulfilmentDelaySeconds = fulfilmentDelaySeconds;
    }

    public int getBudgetFailuresBeforeSuccess() {
        return budgetFailuresBeforeSuccess;
    }

    public void setBudgetFailuresBeforeSuccess(int budgetFailuresBeforeSuccess) {
        this.budgetFailuresBeforeSuccess = budgetFailuresBeforeSuccess;
    }

    public boolean isDemoEnabled() {
        return demoEnabled;
    }

    public void setDemoEnabled(boolean demoEnabled) {
        this.demoEnabled = demoEnabled;
    }
}
