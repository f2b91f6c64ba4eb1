package com.iot.diagnostics.config;

import com.iot.diagnostics.model.ModelDescriptor;
import com.iot.diagnostics.model.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Builds the shared model registry and the clock used for diagnosis timestamps.
 */
@Configuration
@EnableConfigurationProperties(DiagnosticsProperties.class)
@Slf4j
public class ModelRegistryConfig {

    @Bean
    public ModelRegistry modelRegistry(DiagnosticsProperties properties) {
        if (properties.models().isEmpty()) {
            throw new IllegalStateException("No models configured under app.models");
        }

        List<ModelDescriptor> descriptors = properties.models().stream()
                .map(ModelFactory::create)
                .toList();

        ModelRegistry registry;
        try {
            registry = new ModelRegistry(descriptors);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }

        for (ModelDescriptor descriptor : registry) {
            log.info("Registered model: name={}, features={}", descriptor.name(), descriptor.features());
        }
        return registry;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
