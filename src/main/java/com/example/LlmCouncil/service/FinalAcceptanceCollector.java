package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.model.ChairmanDecision;
import com.example.LlmCouncil.model.FinalClaim;
import com.example.LlmCouncil.model.FinalClaimRound;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import com.example.LlmCouncil.model.ModelResponse;
import com.example.LlmCouncil.model.ResponseRound;
import com.example.LlmCouncil.model.Stage;
import com.example.LlmCouncil.util.NumberExtractor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Each bidder submits its final MCC claim knowing only the value the chairman chose to communicate.
 * The chairman's private decision never reaches a bidder prompt.
 */
@Service
@RequiredArgsConstructor
public class FinalAcceptanceCollector {

    private static final Logger log = LoggerFactory.getLogger(FinalAcceptanceCollector.class);

    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    public FinalClaimRound collect(String userQuery, ResponseRound responses, ChairmanDecision decision) {
        List<ModelResponse> answers = responses.responses();

        BidderFanOut.Result<FinalClaim> round = BidderFanOut.join(
                "accept", answers, ModelResponse::modelId, answer -> {
                    double communicated = decision.communicationFor(answer.modelId());
                    ModelReply reply = modelInvocationService.invoke(ModelCall.of(Stage.ACCEPT, answer.modelId(),
                            buildPrompt(userQuery, answer, communicated),
                            properties.invocation().finalAcceptanceMaxTokens(), properties.invocation().bidderTimeout()));

                    double claim = NumberExtractor.percentage(reply.text())
                            .orElseThrow(() -> new IllegalArgumentException(
                                    "Final claim from " + answer.modelId() + " has no number"));
                    return new FinalClaim(answer.modelId(), communicated, claim, reply.text());
                });

        FinalClaimRound result = new FinalClaimRound(round.successes(), round.failedBidders());
        if (!result.dropped().isEmpty()) {
            log.warn("Dropped bidders after final acceptance, excluded from settlement: {}", result.dropped());
        }
        return result;
    }

    private String buildPrompt(String userQuery, ModelResponse own, double communicated) {
        String penalty = String.format(Locale.US, "%.2f", properties.settlement().penaltyRate());
        return """
                For the following user prompt:
                <prompt>
                %s
                </prompt>

                You gave this answer:
                <your_answer>
                %s
                </your_answer>

                You auto-evaluated your Marginal Contribution Coefficient (MCC) (probability of the user preferring \
                your answer instead of the aggregate answer).

                After reading your arguments, the aggregator says its final decision was %s%%.

                Now you will need to submit a final claim. The value you will be paid is the following:
                - If your claim is higher than the aggregator's decision: decision - %s x (claim - decision) \
                (note it's less than if you agreed with the aggregator's value)
                - If your claim is lower than or equal to the aggregator's decision: (decision + claim) / 2

                IMPORTANT: Answer with just your final MCC claim between 0 and 100 (only the number, no other text).""".formatted(
                userQuery,
                own.response(),
                String.format(Locale.US, "%.1f", communicated),
                penalty);
    }
}
