package com.iot.diagnostics.service;

import com.iot.common.dto.diagnosis.ConsensusMap;
import com.iot.common.model.prediction.LabelOutput;
import com.iot.common.model.prediction.ModelOutput;
import com.iot.common.model.prediction.NumericOutput;
import com.iot.diagnostics.model.ModelRegistry;
import com.iot.diagnostics.model.RecordPredictions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-record predictions into one consensus value per model.
 *
 * Sentinels and non-finite numbers are dropped first. If only numbers are
 * left the consensus is their mean, otherwise the most frequent value wins
 * and ties go to the value seen first. A model with nothing left reports
 * {@code Insufficient Data}.
 */
@Service
public class PredictionAggregator {

    private final ModelRegistry modelRegistry;

    public PredictionAggregator(ModelRegistry modelRegistry) {
        this.modelRegistry = modelRegistry;
    }

    /**
     * Returns a consensus for every registered model. The batch health
     * verdict is attached later, during reconciliation.
     */
    public ConsensusMap aggregate(List<RecordPredictions> predictions) {
        Map<String, ModelOutput> consensus = new LinkedHashMap<>();
        for (String modelName : modelRegistry.names()) {
            List<ModelOutput> outputs = new ArrayList<>(predictions.size());
            for (RecordPredictions record : predictions) {
                ModelOutput output = record.get(modelName);
                if (output != null) {
                    outputs.add(output);
                }
            }
            consensus.put(modelName, consensus(outputs));
        }
        return ConsensusMap.of(consensus);
    }

    /**
     * Consensus of one model's outputs across a batch.
     */
    static ModelOutput consensus(List<ModelOutput> outputs) {
        List<ModelOutput> usable = outputs.stream()
                .filter(PredictionAggregator::isUsable)
                .toList();

        if (usable.isEmpty()) {
            return ModelOutput.insufficientData();
        }
        if (usable.stream().allMatch(NumericOutput.class::isInstance)) {
            double mean = usable.stream()
                    .mapToDouble(output -> ((NumericOutput) output).value())
                    .average()
                    .orElseThrow();
            return ModelOutput.numeric(mean);
        }
        return majority(usable);
    }

    private static boolean isUsable(ModelOutput output) {
        if (output instanceof NumericOutput numeric) {
            return numeric.isFinite();
        }
        return output instanceof LabelOutput;
    }

    /**
     * Most frequent value; LinkedHashMap keeps first-seen order so ties are stable.
     */
    private static ModelOutput majority(List<ModelOutput> outputs) {
        Map<ModelOutput, Integer> counts = new LinkedHashMap<>();
        for (ModelOutput output : outputs) {
            counts.merge(output, 1, Integer::sum);
        }

        ModelOutput winner = null;
        int best = 0;
        for (Map.Entry<ModelOutput, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return winner;
    }
}
