package com.example.LlmCouncil.exception;

/**
 * A single model call failed, returned nothing, or exceeded its timeout.
 */
public class ModelInvocationException extends RuntimeException {

    private final String modelId;

    public ModelInvocationException(String modelId, String message) {
        super(message);
        this.modelId = modelId;
    }

    public ModelInvocationException(String modelId, String message, Throwable cause) {
        super(message, cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
