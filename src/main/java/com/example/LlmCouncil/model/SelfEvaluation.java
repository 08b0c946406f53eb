package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

public record SelfEvaluation(
        String modelId,
        double chairmanMcc,
        double selfMcc,
        String arguments
) {

    public SelfEvaluation rounded() {
        return new SelfEvaluation(modelId, Rounding.percent(chairmanMcc), Rounding.percent(selfMcc), arguments);
    }
}
