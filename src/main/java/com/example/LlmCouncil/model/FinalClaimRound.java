package com.example.LlmCouncil.model;

import java.util.List;

/**
 * Output of the final acceptance stage. Dropped bidders receive no payment.
 */
public record FinalClaimRound(
        List<FinalClaim> claims,
        List<String> dropped
) {

    public FinalClaimRound rounded() {
        return new FinalClaimRound(claims.stream().map(FinalClaim::rounded).toList(), dropped);
    }
}
