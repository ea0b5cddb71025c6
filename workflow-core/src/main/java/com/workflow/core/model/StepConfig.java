package com.workflow.core.model;

import java.util.Map;

/**
 * Kind-specific configuration of a workflow step.
 * One implementation per {@link StepKind}; the untyped map form exists
 * only at the persistence boundary, see {@link StepConfigs}.
 */
public interface StepConfig {

    /**
     * The step kind this configuration belongs to.
     */
    StepKind kind();

    /**
     * Flatten to the key-value form used for storage.
     */
    Map<String, Object> toMap();
}
