package com.example.LlmCouncil.model;

import com.example.LlmCouncil.util.Rounding;

import java.util.List;
import java.util.Optional;

/**
 * Output of the token auction.
 *
 * @param quotes        every successful quote in arrival order, winners flagged as selected
 * @param bidders       the bidder set: model ids of the selected quotes, cheapest first
 * @param failedQuoters candidates whose quote call failed or timed out
 * @param valueBasisUsd currency value that MCC percentages are settled against
 */
public record AuctionResult(
        List<Quote> quotes,
        List<String> bidders,
        List<String> failedQuoters,
        double valueBasisUsd
) {

    public Optional<Quote> quoteFor(String modelId) {
        return quotes.stream().filter(q -> q.modelId().equals(modelId)).findFirst();
    }

    public double totalEstimatedCost() {
        return quotes.stream().mapToDouble(Quote::estimatedCost).sum();
    }

    public AuctionResult rounded() {
        return new AuctionResult(
                quotes.stream().map(Quote::rounded).toList(),
                bidders,
                failedQuoters,
                Rounding.currency(valueBasisUsd)
        );
    }
}
