package com.workflow.examples;

import com.workflow.engine.config.WorkflowEngineConfiguration;
import com.workflow.recovery.RecoveryConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({WorkflowEngineConfiguration.class, RecoveryConfiguration.class})
public class PurchaseOrderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PurchaseOrderApplication.class, args);
    }
}
