package com.example.LlmCouncil.exception;

import com.example.LlmCouncil.model.Stage;

/**
 * Chairman output that stayed invalid after the single repair pass.
 */
public class ValidationException extends StageFatalException {

    public ValidationException(Stage stage, String message) {
        super(stage, message);
    }

    public ValidationException(Stage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
