package com.example.LlmCouncil.model;

/**
 * Pricing catalog entry for a model that may bid in the token auction.
 *
 * @param modelId               provider model identifier (e.g. "openai/gpt-4o")
 * @param inputCostPerMillion   USD per million prompt tokens
 * @param outputCostPerMillion  USD per million completion tokens
 */
public record CandidateModel(
        String modelId,
        double inputCostPerMillion,
        double outputCostPerMillion
) {
}
