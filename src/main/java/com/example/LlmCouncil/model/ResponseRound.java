package com.example.LlmCouncil.model;

import java.util.List;
import java.util.Optional;

/**
 * Output of the response stage.
 *
 * @param responses answers of the surviving bidders, in bidder-set order
 * @param dropped   bidders whose call failed or timed out; they take no further part in the exchange
 */
public record ResponseRound(
        List<ModelResponse> responses,
        List<String> dropped
) {

    public List<String> survivingBidders() {
        return responses.stream().map(ModelResponse::modelId).toList();
    }

    public Optional<ModelResponse> responseOf(String modelId) {
        return responses.stream().filter(r -> r.modelId().equals(modelId)).findFirst();
    }
}
