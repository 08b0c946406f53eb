package com.example.LlmCouncil.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The conversation cannot start a run right now: another run holds it,
 * or there is nothing to resume.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ConversationBusyException extends RuntimeException {

    public ConversationBusyException(String message) {
        super(message);
    }
}
