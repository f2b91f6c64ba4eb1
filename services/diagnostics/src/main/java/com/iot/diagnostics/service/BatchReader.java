package com.iot.diagnostics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.iot.common.model.SensorReading;
import com.iot.common.util.JsonUtil;
import com.iot.diagnostics.config.DiagnosticsProperties;
import com.iot.diagnostics.exception.InvalidBatchException;
import com.iot.diagnostics.exception.MalformedPayloadException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a raw payload into sensor readings and enforces the batch shape:
 * a JSON array of 1 to {@code app.diagnostics.max-batch-size} objects.
 */
@Component
public class BatchReader {

    static final String NOT_AN_ARRAY = "Input must be an array";
    static final String EMPTY_BATCH = "Input array cannot be empty";
    static final String NO_CONTENT = "Invalid JSON input: No content to map due to end-of-input";

    private final int maxBatchSize;

    @Autowired
    public BatchReader(DiagnosticsProperties properties) {
        this(properties.diagnostics().maxBatchSize());
    }

    public BatchReader(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public List<SensorReading> read(String payload) {
        JsonNode root;
        try {
            root = JsonUtil.readTree(payload == null ? "" : payload);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Invalid JSON input: " + e.getOriginalMessage(), e);
        }

        // Blank input parses to a missing node rather than failing
        if (root == null || root.isMissingNode()) {
            throw new MalformedPayloadException(NO_CONTENT, null);
        }
        if (!root.isArray()) {
            throw new InvalidBatchException(NOT_AN_ARRAY);
        }
        if (root.size() > maxBatchSize) {
            throw new InvalidBatchException("Input array exceeds maximum length of " + maxBatchSize);
        }
        if (root.isEmpty()) {
            throw new InvalidBatchException(EMPTY_BATCH);
        }

        List<SensorReading> readings = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new InvalidBatchException("Record at index " + i + " must be a JSON object");
            }
            readings.add(SensorReading.of(JsonUtil.toRecordValues(element)));
        }
        return readings;
    }
}
