package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

/**
 * A bidder's token quote from the auction stage.
 *
 * @param modelId              quoting model
 * @param quotedTokens         completion tokens the model asked for
 * @param promptTokens         estimated prompt tokens of the quoting request
 * @param inputCostPerMillion  catalog input price
 * @param outputCostPerMillion catalog output price
 * @param estimatedCost        USD cost implied by the quote
 * @param selected             true when the quote won a seat in the bidder set
 * @param rawResponse          model reply the token count was parsed from (null if estimated locally)
 */
public record Quote(
        String modelId,
        int quotedTokens,
        int promptTokens,
        double inputCostPerMillion,
        double outputCostPerMillion,
        double estimatedCost,
        boolean selected,
        String rawResponse
) {

    public Quote markSelected() {
        return new Quote(modelId, quotedTokens, promptTokens, inputCostPerMillion,
                outputCostPerMillion, estimatedCost, true, rawResponse);
    }

    public Quote rounded() {
        return new Quote(modelId, quotedTokens, promptTokens, inputCostPerMillion,
                outputCostPerMillion, Rounding.currency(estimatedCost), selected, rawResponse);
    }
}
