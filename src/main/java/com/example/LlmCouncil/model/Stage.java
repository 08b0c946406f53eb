package com.example.LlmCouncil.model;

/**
 * The seven council stages, in execution order.
 *
 * key   - wire name used in event types ("quote_start", "quote_complete") and
 *         as the persisted checkpoint field of an exchange
 * state - pipeline state while the stage is running
 */
public enum Stage {

    QUOTE("quote", PipelineState.QUOTING, AuctionResult.class),
    RESPOND("respond", PipelineState.RESPONDING, ResponseRound.class),
    AGGREGATE("aggregate", PipelineState.AGGREGATING, ChairmanEvaluation.class),
    SELF_EVALUATE("self_evaluate", PipelineState.SELF_EVALUATING, SelfEvaluationRound.class),
    FINALIZE("finalize", PipelineState.FINALIZING, ChairmanDecision.class),
    ACCEPT("accept", PipelineState.ACCEPTING, FinalClaimRound.class),
    SETTLE("settle", PipelineState.SETTLING, Settlement.class);

    private final String key;
    private final PipelineState state;
    private final Class<?> outputType;

    Stage(String key, PipelineState state, Class<?> outputType) {
        this.key = key;
        this.state = state;
        this.outputType = outputType;
    }

    public String key() {
        return key;
    }

    public PipelineState state() {
        return state;
    }

    /**
     * Canonical payload type of the stage's "complete" event and checkpoint.
     */
    public Class<?> outputType() {
        return outputType;
    }

    /** 1-based position, used for "[3/7]" style progress logs. */
    public int number() {
        return ordinal() + 1;
    }

    public static Stage fromKey(String key) {
        for (Stage stage : values()) {
            if (stage.key.equals(key)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + key);
    }
}
