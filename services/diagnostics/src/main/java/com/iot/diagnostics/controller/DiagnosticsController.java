package com.iot.diagnostics.controller;

import com.iot.common.dto.diagnosis.BatchDiagnosticResponse;
import com.iot.diagnostics.model.ModelDescriptor;
import com.iot.diagnostics.model.ModelRegistry;
import com.iot.diagnostics.service.DiagnosticService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST controller for diagnosing batches of machine sensor readings.
 *
 * Endpoints:
 * - POST /api/v1/diagnostics/batch - Diagnose a JSON array of readings
 * - GET /api/v1/diagnostics/models - Configured models and their features
 * - GET /api/v1/diagnostics/health - Connectivity check
 */
@RestController
@RequestMapping("/api/v1/diagnostics")
public class DiagnosticsController {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsController.class);

    private final DiagnosticService diagnosticService;
    private final ModelRegistry modelRegistry;

    public DiagnosticsController(DiagnosticService diagnosticService, ModelRegistry modelRegistry) {
        this.diagnosticService = diagnosticService;
        this.modelRegistry = modelRegistry;
    }

    /**
     * Diagnose a batch. The body is taken raw so that shape and parse errors
     * are reported with the same messages as the command-line mode.
     */
    @PostMapping(
            path = "/batch",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<BatchDiagnosticResponse>> diagnoseBatch(@RequestBody String payload) {
        log.debug("Received diagnostics batch: bytes={}", payload.length());

        // The pipeline is blocking and CPU-bound; keep it off the event loop
        return Mono.fromCallable(() -> diagnosticService.diagnose(payload))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping(path = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ModelInfo>> models() {
        return Mono.just(modelRegistry.descriptors().stream()
                .map(ModelInfo::from)
                .toList());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    public record ModelInfo(String name, List<String> features) {
        static ModelInfo from(ModelDescriptor descriptor) {
            return new ModelInfo(descriptor.name(), descriptor.features());
        }
    }
}
