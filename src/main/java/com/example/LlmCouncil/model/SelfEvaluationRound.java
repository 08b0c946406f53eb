package com.example.LlmCouncil.model;

import java.util.List;
import java.util.Optional;

/**
 * Output of the self-evaluation stage.
 * Absent bidders failed to self-evaluate but remain eligible for the later stages.
 */
public record SelfEvaluationRound(
        List<SelfEvaluation> evaluations,
        List<String> absent
) {

    public Optional<SelfEvaluation> evaluationOf(String modelId) {
        return evaluations.stream().filter(e -> e.modelId().equals(modelId)).findFirst();
    }

    public SelfEvaluationRound rounded() {
        return new SelfEvaluationRound(evaluations.stream().map(SelfEvaluation::rounded).toList(), absent);
    }
}
