package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

import java.util.List;
import java.util.Optional;

/**
 * Output of the settlement stage.
 *
 * @param payments                one record per bidder that submitted a final claim
 * @param valueBasisUsd           value basis fixed at auction time
 * @param totalChairmanPaymentUsd sum of chairman payments across bidders
 * @param chairmanNetEarningsUsd  value basis minus the total chairman payment, may be negative
 * @param totalBidderReceivesMcc  sum of bidder-receives percentages
 * @param chairmanEarningsMcc     100 minus {@code totalBidderReceivesMcc}
 */
public record Settlement(
        List<PaymentRecord> payments,
        double valueBasisUsd,
        double totalChairmanPaymentUsd,
        double chairmanNetEarningsUsd,
        double totalBidderReceivesMcc,
        double chairmanEarningsMcc
) {

    public Optional<PaymentRecord> paymentFor(String modelId) {
        return payments.stream().filter(p -> p.modelId().equals(modelId)).findFirst();
    }

    public Settlement rounded() {
        return new Settlement(
                payments.stream().map(PaymentRecord::rounded).toList(),
                Rounding.currency(valueBasisUsd),
                Rounding.currency(totalChairmanPaymentUsd),
                Rounding.currency(chairmanNetEarningsUsd),
                Rounding.percent(totalBidderReceivesMcc),
                Rounding.percent(chairmanEarningsMcc)
        );
    }
}
