package com.example.LlmCouncil.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * A single pipeline lifecycle event streamed to the client.
 *
 * type          - "quote_start", "quote_complete", ..., "title_complete", "complete" or "error"
 * stage         - stage key, null for the terminal "complete" event
 * schemaVersion - version of the payload schema, one canonical payload type per stage
 * data          - rounded stage output for "*_complete", summary for "complete"
 * message       - human-readable error description for "error"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageEvent(
        String type,
        String stage,
        int schemaVersion,
        Object data,
        String message
) {

    public static final int SCHEMA_VERSION = 1;

    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";
    public static final String TITLE_COMPLETE = "title_complete";

    public static StageEvent started(Stage stage) {
        return new StageEvent(stage.key() + "_start", stage.key(), SCHEMA_VERSION, null, null);
    }

    public static StageEvent completed(Stage stage, Object data) {
        return new StageEvent(stage.key() + "_complete", stage.key(), SCHEMA_VERSION, data, null);
    }

    public static StageEvent finished(String conversationId, String exchangeId) {
        return new StageEvent(COMPLETE, null, SCHEMA_VERSION,
                Map.of("conversationId", conversationId, "exchangeId", exchangeId), null);
    }

    public static StageEvent titled(String title) {
        return new StageEvent(TITLE_COMPLETE, null, SCHEMA_VERSION, Map.of("title", title), null);
    }

    public static StageEvent failed(Stage stage, String message) {
        return new StageEvent(ERROR, stage == null ? null : stage.key(), SCHEMA_VERSION, null, message);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return COMPLETE.equals(type) || ERROR.equals(type);
    }
}
