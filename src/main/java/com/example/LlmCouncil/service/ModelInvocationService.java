package com.example.LlmCouncil.service;

import com.example.LlmCouncil.exception.ModelInvocationException;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;

/**
 * Sends one prompt to one model.
 * Implementations enforce {@link ModelCall#timeout()} and never return an empty reply.
 */
@FunctionalInterface
public interface ModelInvocationService {

    /**
     * @throws ModelInvocationException when the call fails, times out or returns no text
     */
    ModelReply invoke(ModelCall call);
}
