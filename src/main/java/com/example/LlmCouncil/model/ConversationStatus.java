package com.example.LlmCouncil.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Gate for pipeline runs: a new run may only begin on an IDLE -> PROCESSING transition.
 * A conversation whose run failed or was interrupted stays PROCESSING until resumed.
 */
public enum ConversationStatus {
    IDLE,
    PROCESSING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConversationStatus fromWireName(String value) {
        return ConversationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
