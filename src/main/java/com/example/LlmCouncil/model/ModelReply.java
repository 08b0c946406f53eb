package com.example.LlmCouncil.model;

/**
 * Text and usage metadata of a successful model call.
 */
public record ModelReply(
        String modelId,
        String text,
        Integer promptTokens,
        Integer completionTokens
) {

    public static ModelReply of(String modelId, String text) {
        return new ModelReply(modelId, text, null, null);
    }
}
