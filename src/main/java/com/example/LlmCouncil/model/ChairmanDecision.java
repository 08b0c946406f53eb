package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

import java.util.Map;

/**
 * Chairman's final credit decisions.
 * <p>
 * {@code decisions} is the private, authoritative MCC used for settlement.
 * {@code communications} is what each bidder is told and may deliberately differ.
 * Neither mapping is sum-constrained.
 */
public record ChairmanDecision(
        String chairmanModel,
        Map<String, Double> decisions,
        Map<String, Double> communications
) {

    public double decisionFor(String modelId) {
        Double value = decisions.get(modelId);
        if (value == null) {
            throw new IllegalStateException("No final decision recorded for bidder " + modelId);
        }
        return value;
    }

    public double communicationFor(String modelId) {
        Double value = communications.get(modelId);
        if (value == null) {
            throw new IllegalStateException("No communication value recorded for bidder " + modelId);
        }
        return value;
    }

    public ChairmanDecision rounded() {
        return new ChairmanDecision(chairmanModel, Rounding.percents(decisions), Rounding.percents(communications));
    }
}
