package com.example.LlmCouncil.model;

public record ModelResponse(
        String modelId,
        String response,
        Integer completionTokens
) {
}
