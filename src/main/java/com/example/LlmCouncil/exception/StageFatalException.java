package com.example.LlmCouncil.exception;

import com.example.LlmCouncil.model.Stage;

/**
 * A stage could not produce its output: the chairman call failed, no bidder quoted,
 * or no bidder answered. The exchange stops and waits for a resume, which retries {@link #getStage()}.
 */
public class StageFatalException extends RuntimeException {

    private final Stage stage;

    public StageFatalException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageFatalException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
