package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

/**
 * @param modelId         claiming bidder
 * @param communicatedMcc value the chairman disclosed to the bidder
 * @param finalMcc        MCC the bidder finally claims
 * @param rawResponse     reply the claim was parsed from
 */
public record FinalClaim(
        String modelId,
        double communicatedMcc,
        double finalMcc,
        String rawResponse
) {

    public FinalClaim rounded() {
        return new FinalClaim(modelId, Rounding.percent(communicatedMcc), Rounding.percent(finalMcc), rawResponse);
    }
}
