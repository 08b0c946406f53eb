package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.StageFatalException;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import com.example.LlmCouncil.model.ModelResponse;
import com.example.LlmCouncil.model.Quote;
import com.example.LlmCouncil.model.ResponseRound;
import com.example.LlmCouncil.model.Stage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends the user prompt to every bidder and keeps the answers of those that respond.
 */
@Service
@RequiredArgsConstructor
public class ResponseCollector {

    private static final Logger log = LoggerFactory.getLogger(ResponseCollector.class);

    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    /**
     * @param context rendered prior conversation, may be null
     */
    public ResponseRound collect(String userQuery, AuctionResult auction, String context) {
        String prompt = buildPrompt(userQuery, auction.bidders().size());

        BidderFanOut.Result<ModelResponse> round = BidderFanOut.join(
                "respond", auction.bidders(), bidder -> bidder, bidder -> {
                    Integer maxTokens = auction.quoteFor(bidder).map(Quote::quotedTokens).orElse(null);
                    ModelReply reply = modelInvocationService.invoke(
                            ModelCall.of(Stage.RESPOND, bidder, prompt, maxTokens, properties.invocation().bidderTimeout())
                                    .withContext(context));
                    return new ModelResponse(bidder, reply.text(), reply.completionTokens());
                });

        ResponseRound result = new ResponseRound(round.successes(), round.failedBidders());
        if (result.responses().isEmpty()) {
            throw new StageFatalException(Stage.RESPOND, "All bidders failed to respond");
        }
        if (!result.dropped().isEmpty()) {
            log.warn("Dropped bidders after response stage: {}", result.dropped());
        }
        return result;
    }

    private String buildPrompt(String userQuery, int bidderCount) {
        return """
                Answer to the following user prompt:
                <prompt>
                %s
                </prompt>

                Take into account that other %d LLMs are answering as well and you will be paid based on your \
                Marginal Contribution Coefficient (probability of the user preferring your answer instead of the \
                aggregate answer).

                So you should both give a complete answer and bring to the table value that the other LLMs may not \
                bring. Information no other LLM mentions will be more valuable than what everyone else mentions.

                IMPORTANT: Respond with just your answer to the user prompt""".formatted(userQuery, Math.max(0, bidderCount - 1));
    }
}
