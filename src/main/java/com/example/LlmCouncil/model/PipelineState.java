package com.example.LlmCouncil.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PipelineState {
    QUOTING,
    RESPONDING,
    AGGREGATING,
    SELF_EVALUATING,
    FINALIZING,
    ACCEPTING,
    SETTLING,
    DONE,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
