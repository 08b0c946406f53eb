package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.StageFatalException;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.CandidateModel;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import com.example.LlmCouncil.model.Quote;
import com.example.LlmCouncil.model.Stage;
import com.example.LlmCouncil.util.NumberExtractor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Token auction: every catalog candidate quotes the tokens it wants to spend,
 * the cheapest k quotes win a seat in the bidder set.
 */
@Service
@RequiredArgsConstructor
public class TokenAuctionService {

    private static final Logger log = LoggerFactory.getLogger(TokenAuctionService.class);

    /** Quote replies are a single integer. */
    private static final int QUOTE_MAX_TOKENS = 64;

    private final PricingCatalog pricingCatalog;
    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    public AuctionResult runAuction(String userQuery) {
        List<CandidateModel> candidates = pricingCatalog.listCandidates();
        if (candidates.isEmpty()) {
            throw new StageFatalException(Stage.QUOTE, "Pricing catalog has no candidate models");
        }

        BidderFanOut.Result<Quote> quoting = BidderFanOut.join(
                "quote", candidates, CandidateModel::modelId, c -> quote(c, userQuery, candidates.size()));

        List<Quote> arrivals = quoting.successesInArrivalOrder();
        if (arrivals.isEmpty()) {
            throw new StageFatalException(Stage.QUOTE, "No candidate model returned a quote");
        }

        return select(arrivals, quoting.failedBidders(), properties.auction().bidderCount());
    }

    /**
     * Rank quotes by estimated cost and mark the k cheapest as selected.
     * The sort is stable, so equal costs keep arrival order.
     *
     * @param arrivals successful quotes in arrival order
     */
    AuctionResult select(List<Quote> arrivals, List<String> failedQuoters, int bidderCount) {
        List<Quote> ranked = arrivals.stream()
                .sorted(Comparator.comparingDouble(Quote::estimatedCost))
                .toList();

        int seats = Math.min(bidderCount, ranked.size());
        List<String> bidders = ranked.subList(0, seats).stream().map(Quote::modelId).toList();
        Set<String> winners = new HashSet<>(bidders);

        List<Quote> quotes = new ArrayList<>(arrivals.size());
        double selectedCost = 0.0;
        for (Quote quote : arrivals) {
            if (winners.contains(quote.modelId())) {
                quotes.add(quote.markSelected());
                selectedCost += quote.estimatedCost();
            } else {
                quotes.add(quote);
            }
        }

        Double contractValue = properties.settlement().contractValueUsd();
        double valueBasis = contractValue != null ? contractValue : selectedCost;

        log.info("Auction selected {} of {} quotes: {} (value basis {} USD)",
                seats, arrivals.size(), bidders, String.format(Locale.US, "%.6f", valueBasis));
        return new AuctionResult(List.copyOf(quotes), bidders, failedQuoters, valueBasis);
    }

    private Quote quote(CandidateModel candidate, String userQuery, int candidateCount) {
        String prompt = buildQuotePrompt(candidate, userQuery, candidateCount);
        int promptTokens = estimateTokens(prompt);
        int defaultTokens = properties.auction().defaultQuotedTokens();

        if (!properties.auction().askBidders()) {
            return toQuote(candidate, defaultTokens, promptTokens, null);
        }

        ModelReply reply = modelInvocationService.invoke(
                ModelCall.of(Stage.QUOTE, candidate.modelId(), prompt, QUOTE_MAX_TOKENS, properties.auction().quoteTimeout()));
        int quotedTokens = NumberExtractor.parseTokenCount(reply.text(), defaultTokens);
        return toQuote(candidate, quotedTokens, promptTokens, reply.text());
    }

    private Quote toQuote(CandidateModel candidate, int quotedTokens, int promptTokens, String raw) {
        double estimatedCost = (promptTokens * candidate.inputCostPerMillion()
                + quotedTokens * candidate.outputCostPerMillion()) / 1_000_000.0;
        return new Quote(candidate.modelId(), quotedTokens, promptTokens, candidate.inputCostPerMillion(),
                candidate.outputCostPerMillion(), estimatedCost, false, raw);
    }

    /**
     * Rough prompt size: four characters per token.
     */
    static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }

    private String buildQuotePrompt(CandidateModel candidate, String userQuery, int candidateCount) {
        return """
                This user prompt:
                <prompt>
                %s
                </prompt>

                Is being answered by %d LLMs. Each LLM will make a quote that corresponds to the amount of tokens \
                they want to use times the cost per million tokens. Then the user will be charged the sum of the \
                winning quotes and you will be paid that sum times your Marginal Contribution Coefficient \
                (probability of the user preferring your answer instead of the aggregate answer). \
                Only the %d cheapest quotes are selected.

                Given your cost per million output tokens is $%s and the complexity of the prompt, estimate how \
                many tokens you should use in order to make a profit and answer with just that value.

                IMPORTANT: Respond with ONLY a single integer number representing the token count. \
                Do not include any other text, explanation, or formatting.""".formatted(
                userQuery,
                candidateCount,
                properties.auction().bidderCount(),
                String.format(Locale.US, "%.2f", candidate.outputCostPerMillion()));
    }
}
