package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

/**
 * Settled payment for one bidder. MCC fields are percentages, USD fields are currency.
 * {@code selfEvaluationMcc} is null when the bidder did not self-evaluate.
 */
public record PaymentRecord(
        String modelId,
        double decisionMcc,
        double claimMcc,
        Double selfEvaluationMcc,
        double chairmanPaysMcc,
        double bidderReceivesMcc,
        double bidderPaymentUsd,
        double chairmanPaymentUsd,
        double quotedCostUsd,
        double profitUsd
) {

    public PaymentRecord rounded() {
        return new PaymentRecord(
                modelId,
                Rounding.percent(decisionMcc),
                Rounding.percent(claimMcc),
                selfEvaluationMcc == null ? null : Rounding.percent(selfEvaluationMcc),
                Rounding.percent(chairmanPaysMcc),
                Rounding.percent(bidderReceivesMcc),
                Rounding.currency(bidderPaymentUsd),
                Rounding.currency(chairmanPaymentUsd),
                Rounding.currency(quotedCostUsd),
                Rounding.currency(profitUsd)
        );
    }
}
