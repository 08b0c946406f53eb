package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

import java.util.Map;

/**
 * Chairman's synthesized answer and initial credit split.
 *
 * @param chairmanModel    model that acted as chairman
 * @param aggregatedAnswer synthesized answer shown to the user
 * @param mccs             bidder -> initial MCC percentage, summing to 100 within tolerance
 * @param rawMccs          values as the chairman returned them, kept for audit
 * @param renormalized     true when {@code mccs} were rescaled or repaired from {@code rawMccs}
 */
public record ChairmanEvaluation(
        String chairmanModel,
        String aggregatedAnswer,
        Map<String, Double> mccs,
        Map<String, Double> rawMccs,
        boolean renormalized
) {

    public double mccOf(String modelId) {
        return mccs.getOrDefault(modelId, 0.0);
    }

    public ChairmanEvaluation rounded() {
        return new ChairmanEvaluation(chairmanModel, aggregatedAnswer,
                Rounding.percents(mccs), Rounding.percents(rawMccs), renormalized);
    }
}
