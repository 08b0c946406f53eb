package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.ChairmanEvaluation;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import com.example.LlmCouncil.model.ModelResponse;
import com.example.LlmCouncil.model.Quote;
import com.example.LlmCouncil.model.ResponseRound;
import com.example.LlmCouncil.model.SelfEvaluation;
import com.example.LlmCouncil.model.SelfEvaluationRound;
import com.example.LlmCouncil.model.Stage;
import com.example.LlmCouncil.util.JsonReplyParser;
import com.example.LlmCouncil.util.NumberExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Each surviving bidder argues for its own MCC after seeing the chairman's first evaluation.
 * The claims are independent of each other and are never renormalized.
 */
@Service
@RequiredArgsConstructor
public class SelfEvaluationCollector {

    private static final Logger log = LoggerFactory.getLogger(SelfEvaluationCollector.class);

    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    public SelfEvaluationRound collect(String userQuery,
                                       ResponseRound responses,
                                       ChairmanEvaluation evaluation,
                                       AuctionResult auction) {
        List<ModelResponse> answers = responses.responses();

        BidderFanOut.Result<SelfEvaluation> round = BidderFanOut.join(
                "self_evaluate", answers, ModelResponse::modelId, answer -> {
                    double chairmanMcc = evaluation.mccOf(answer.modelId());
                    double quotedCost = auction.quoteFor(answer.modelId()).map(Quote::estimatedCost).orElse(0.0);
                    String prompt = buildPrompt(userQuery, answers, answer, evaluation.aggregatedAnswer(),
                            chairmanMcc, quotedCost);

                    ModelReply reply = modelInvocationService.invoke(ModelCall.of(Stage.SELF_EVALUATE, answer.modelId(),
                            prompt, properties.invocation().selfEvaluationMaxTokens(), properties.invocation().bidderTimeout()));
                    return parse(answer.modelId(), chairmanMcc, reply.text());
                });

        SelfEvaluationRound result = new SelfEvaluationRound(round.successes(), round.failedBidders());
        if (!result.absent().isEmpty()) {
            // Advisory only: these bidders stay in the council
            log.warn("No self-evaluation from {}", result.absent());
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException when the reply carries no usable MCC
     */
    static SelfEvaluation parse(String modelId, double chairmanMcc, String reply) {
        JsonNode parsed = JsonReplyParser.parseObject(reply)
                .orElseThrow(() -> new IllegalArgumentException("Self-evaluation from " + modelId + " is not valid JSON"));
        OptionalDouble selfMcc = JsonReplyParser.number(parsed, "MCC");
        if (selfMcc.isEmpty()) {
            throw new IllegalArgumentException("Self-evaluation from " + modelId + " has no MCC");
        }
        String arguments = JsonReplyParser.text(parsed, "arguments").orElse("");
        return new SelfEvaluation(modelId, chairmanMcc, NumberExtractor.clampPercent(selfMcc.getAsDouble()), arguments);
    }

    private String buildPrompt(String userQuery, List<ModelResponse> answers, ModelResponse own,
                               String aggregatedAnswer, double chairmanMcc, double quotedCost) {
        String otherAnswers = IntStream.range(0, answers.size())
                .filter(i -> !answers.get(i).modelId().equals(own.modelId()))
                .mapToObj(i -> "LLM " + (i + 1) + ":\n" + answers.get(i).response())
                .collect(Collectors.joining("\n\n"));

        return """
                For the given user prompt:
                <prompt>
                %s
                </prompt>

                You gave this answer:
                <your_answer>
                %s
                </your_answer>

                And other %d LLMs gave these answers:
                %s

                The final aggregated answer was:
                <aggregated_answer>
                %s
                </aggregated_answer>

                You now need to auto-evaluate your Marginal Contribution Coefficient (MCC) (probability of the user \
                preferring your answer instead of the aggregate answer).

                The aggregator evaluated your answer with an MCC of %s%%. You spent $%s and you will be paid \
                proportionally to your MCC, so you need to give arguments in favor of your evaluation.

                Answer in the following JSON format (no additional text):
                {
                  "arguments": "what unique value your answer brings to the table",
                  "MCC": percentage value between 0 and 100
                }

                IMPORTANT: Return ONLY valid JSON, nothing else.""".formatted(
                userQuery,
                own.response(),
                answers.size() - 1,
                otherAnswers,
                aggregatedAnswer,
                String.format(Locale.US, "%.1f", chairmanMcc),
                String.format(Locale.US, "%.4f", quotedCost));
    }
}
