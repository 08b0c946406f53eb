package com.example.LlmCouncil.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One user question and everything the council produced for it.
 * <p>
 * Instances are immutable. Each completed stage yields a new instance through
 * {@link #with(Stage, Object)}; a stage field that is non-null is a completed checkpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Exchange(
        String id,
        String question,
        Instant createdAt,
        AuctionResult auction,
        ResponseRound responses,
        ChairmanEvaluation evaluation,
        SelfEvaluationRound selfEvaluations,
        ChairmanDecision decision,
        FinalClaimRound claims,
        Settlement settlement,
        ExchangeFailure failure
) {

    public static Exchange start(String id, String question, Instant createdAt) {
        return new Exchange(id, question, createdAt, null, null, null, null, null, null, null, null);
    }

    /**
     * Apply a stage output and return the resulting exchange.
     */
    public Exchange with(Stage stage, Object output) {
        if (output != null && !stage.outputType().isInstance(output)) {
            throw new IllegalArgumentException("Stage " + stage.key() + " expects "
                    + stage.outputType().getSimpleName() + " but got " + output.getClass().getSimpleName());
        }
        return switch (stage) {
            case QUOTE -> new Exchange(id, question, createdAt, (AuctionResult) output, responses, evaluation,
                    selfEvaluations, decision, claims, settlement, failure);
            case RESPOND -> new Exchange(id, question, createdAt, auction, (ResponseRound) output, evaluation,
                    selfEvaluations, decision, claims, settlement, failure);
            case AGGREGATE -> new Exchange(id, question, createdAt, auction, responses, (ChairmanEvaluation) output,
                    selfEvaluations, decision, claims, settlement, failure);
            case SELF_EVALUATE -> new Exchange(id, question, createdAt, auction, responses, evaluation,
                    (SelfEvaluationRound) output, decision, claims, settlement, failure);
            case FINALIZE -> new Exchange(id, question, createdAt, auction, responses, evaluation,
                    selfEvaluations, (ChairmanDecision) output, claims, settlement, failure);
            case ACCEPT -> new Exchange(id, question, createdAt, auction, responses, evaluation,
                    selfEvaluations, decision, (FinalClaimRound) output, settlement, failure);
            case SETTLE -> new Exchange(id, question, createdAt, auction, responses, evaluation,
                    selfEvaluations, decision, claims, (Settlement) output, failure);
        };
    }

    /**
     * Copy with every stage output rounded for display; checkpoints keep full precision.
     */
    public Exchange rounded() {
        return new Exchange(id, question, createdAt,
                auction == null ? null : auction.rounded(),
                responses,
                evaluation == null ? null : evaluation.rounded(),
                selfEvaluations == null ? null : selfEvaluations.rounded(),
                decision == null ? null : decision.rounded(),
                claims == null ? null : claims.rounded(),
                settlement == null ? null : settlement.rounded(),
                failure);
    }

    public Exchange withFailure(ExchangeFailure newFailure) {
        return new Exchange(id, question, createdAt, auction, responses, evaluation,
                selfEvaluations, decision, claims, settlement, newFailure);
    }

    public Object outputOf(Stage stage) {
        return switch (stage) {
            case QUOTE -> auction;
            case RESPOND -> responses;
            case AGGREGATE -> evaluation;
            case SELF_EVALUATE -> selfEvaluations;
            case FINALIZE -> decision;
            case ACCEPT -> claims;
            case SETTLE -> settlement;
        };
    }

    public boolean isCompleted(Stage stage) {
        return outputOf(stage) != null;
    }

    /**
     * First stage without a checkpoint, empty once the exchange is settled.
     */
    public Optional<Stage> nextStage() {
        for (Stage stage : Stage.values()) {
            if (!isCompleted(stage)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    @JsonIgnore
    public boolean isSettled() {
        return settlement != null;
    }

    @JsonProperty("state")
    public PipelineState state() {
        if (isSettled()) {
            return PipelineState.DONE;
        }
        if (failure != null) {
            return PipelineState.FAILED;
        }
        return nextStage().map(Stage::state).orElse(PipelineState.DONE);
    }

    /**
     * Bidders that answered in the response stage; empty before that stage completed.
     */
    public List<String> survivingBidders() {
        return responses == null ? List.of() : responses.survivingBidders();
    }
}
