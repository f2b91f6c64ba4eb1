package com.iot.diagnostics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Settings bound from the {@code app.*} namespace.
 *
 * Example YAML:
 * <pre>
 * app:
 *   diagnostics:
 *     max-batch-size: 1800
 *   models:
 *     - name: temperature
 *       type: linear
 *       features: [temperature_one, temperature_two]
 *       intercept: 0.0
 *       coefficients: [0.5, 0.5]
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record DiagnosticsProperties(
    @Valid
    @DefaultValue
    Diagnostics diagnostics,

    @Valid
    @NotEmpty(message = "At least one model must be configured")
    List<ModelSpec> models
) {
    public DiagnosticsProperties {
        models = models != null ? List.copyOf(models) : List.of();
    }

    public record Diagnostics(
        @Min(1)
        @DefaultValue("1800")
        int maxBatchSize
    ) {}

    /**
     * One configured model. Which parameters apply depends on {@link #type()}.
     */
    public record ModelSpec(
        @NotBlank
        String name,

        @NotNull
        ModelType type,

        @NotEmpty
        List<String> features,

        // linear
        Double intercept,
        List<Double> coefficients,

        // threshold
        List<BandSpec> bands,
        String defaultLabel
    ) {}

    public record BandSpec(
        double below,
        @NotBlank String label
    ) {}

    public enum ModelType {
        LINEAR,     // intercept + coefficients -> number
        THRESHOLD   // mean of features -> band label
    }
}
