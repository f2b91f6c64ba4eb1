package com.iot.diagnostics;

import com.iot.diagnostics.cli.BatchCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Machine Diagnostics Service
 *
 * Runs batches of machine sensor readings through the configured predictive
 * models and the rule-based health engine. Serves HTTP by default; with the
 * {@code cli} profile it diagnoses one batch from stdin and exits.
 */
@SpringBootApplication
public class DiagnosticsApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(DiagnosticsApplication.class, args);
        if (context.getBeanProvider(BatchCommandRunner.class).getIfAvailable() != null) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
