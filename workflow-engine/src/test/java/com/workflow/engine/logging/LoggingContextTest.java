package com.workflow.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void forStep_shouldPopulateCorrelationKeys() {
        try (LoggingContext ignored = LoggingContext.forStep("exec-1", "wf-1", "a", 2)) {
            assertThat(LoggingContext.getExecutionId()).isEqualTo("exec-1");
            assertThat(LoggingContext.getStepId()).isEqualTo("a");
            assertThat(MDC.get(LoggingContext.WORKFLOW_ID)).isEqualTo("wf-1");
            assertThat(MDC.get(LoggingContext.ATTEMPT)).isEqualTo("2");
            assertThat(MDC.get(LoggingContext.TRACE_ID)).hasSize(8);
        }

        assertThat(MDC.get(LoggingContext.EXECUTION_ID)).isNull();
        assertThat(MDC.get(LoggingContext.TRACE_ID)).isNull();
    }

    @Test
    void close_ofNestedStepContext_shouldKeepExecutionKeys() {
        try (LoggingContext outer = LoggingContext.forExecution("exec-1", "wf-1")) {
            String traceId = MDC.get(LoggingContext.TRACE_ID);

            try (LoggingContext inner = LoggingContext.forStep("exec-1", "wf-1", "a", 1)) {
                assertThat(LoggingContext.getStepId()).isEqualTo("a");
                assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo(traceId);
            }

            assertThat(LoggingContext.getStepId()).isNull();
            assertThat(LoggingContext.getExecutionId()).isEqualTo("exec-1");
            assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo(traceId);
        }
    }
}
