package com.iot.diagnostics.cli;

import com.iot.common.dto.diagnosis.BatchDiagnosticResponse;
import com.iot.common.util.JsonUtil;
import com.iot.diagnostics.exception.ErrorResponse;
import com.iot.diagnostics.exception.InvalidBatchException;
import com.iot.diagnostics.exception.MalformedPayloadException;
import com.iot.diagnostics.service.DiagnosticService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * One-shot mode: read a JSON batch from stdin, print exactly one JSON
 * object to stdout, exit 0 on success and 1 on any failure.
 *
 * Enabled with {@code app.cli.enabled=true} (the {@code cli} profile).
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final DiagnosticService diagnosticService;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        exitCode = execute(System.in, System.out);
    }

    /**
     * Reads one payload, writes one JSON line, returns the exit code.
     */
    public int execute(InputStream in, PrintStream out) {
        Object result;
        int code;
        try {
            String payload = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            BatchDiagnosticResponse response = diagnosticService.diagnose(payload);
            result = response;
            code = EXIT_OK;
        } catch (InvalidBatchException | MalformedPayloadException e) {
            result = ErrorResponse.of(e.getMessage());
            code = EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage(), e);
            result = ErrorResponse.of("Failed to read input: " + e.getMessage());
            code = EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Diagnostics failed: {}", e.getMessage(), e);
            result = ErrorResponse.of(e);
            code = EXIT_FAILURE;
        }

        out.println(JsonUtil.toJson(result));
        out.flush();
        return code;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
