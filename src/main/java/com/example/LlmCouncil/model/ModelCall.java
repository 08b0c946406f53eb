package com.example.LlmCouncil.model;

import java.time.Duration;

/**
 * One request to the model invocation service.
 *
 * @param stage     stage issuing the call, used for logging and usage attribution; null outside the pipeline stages
 * @param modelId   target model
 * @param prompt    user prompt
 * @param context   prior conversation context, may be null
 * @param maxTokens completion budget, null for the provider default
 * @param timeout   hard bound on the call
 */
public record ModelCall(
        Stage stage,
        String modelId,
        String prompt,
        String context,
        Integer maxTokens,
        Duration timeout
) {

    public static ModelCall of(Stage stage, String modelId, String prompt, Integer maxTokens, Duration timeout) {
        return new ModelCall(stage, modelId, prompt, null, maxTokens, timeout);
    }

    public ModelCall withContext(String newContext) {
        return new ModelCall(stage, modelId, prompt, newContext, maxTokens, timeout);
    }

    public String label() {
        return stage != null ? stage.key() : "auxiliary";
    }
}
