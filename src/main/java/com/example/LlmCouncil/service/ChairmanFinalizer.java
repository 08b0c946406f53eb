package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.ModelInvocationException;
import com.example.LlmCouncil.exception.StageFatalException;
import com.example.LlmCouncil.exception.ValidationException;
import com.example.LlmCouncil.model.ChairmanDecision;
import com.example.LlmCouncil.model.ChairmanEvaluation;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import com.example.LlmCouncil.model.ModelResponse;
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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Chairman stage two: after reading the self-evaluations, the chairman fixes a private final
 * decision per bidder and chooses what value to communicate to it.
 * <p>
 * The two mappings are kept apart and neither is sum-constrained.
 */
@Service
@RequiredArgsConstructor
public class ChairmanFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ChairmanFinalizer.class);

    private static final Pattern LABELLED_KEY =
            Pattern.compile("(decision_LLM|communicated_to_LLM)_(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final int ARGUMENT_PREVIEW = 200;

    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    public ChairmanDecision finalizeDecisions(String userQuery,
                                              ResponseRound responses,
                                              ChairmanEvaluation evaluation,
                                              SelfEvaluationRound selfEvaluations) {
        String chairman = properties.chairman().model();
        List<ModelResponse> answers = responses.responses();

        ModelReply reply;
        try {
            reply = modelInvocationService.invoke(ModelCall.of(Stage.FINALIZE, chairman,
                    buildPrompt(userQuery, answers, evaluation, selfEvaluations),
                    properties.chairman().maxTokens(), properties.chairman().timeout()));
        } catch (ModelInvocationException e) {
            throw new StageFatalException(Stage.FINALIZE, "Chairman failed to finalize: " + e.getMessage(), e);
        }

        ChairmanDecision decision = parse(chairman, reply.text(), answers);
        log.info("Chairman {} decided {} and communicated {}", chairman, decision.decisions(), decision.communications());
        return decision;
    }

    /**
     * Read "decision_LLM_i" / "communicated_to_LLM_i" pairs; both values are required for every bidder.
     */
    ChairmanDecision parse(String chairman, String reply, List<ModelResponse> answers) {
        JsonNode parsed = JsonReplyParser.parseObject(reply)
                .orElseThrow(() -> new ValidationException(Stage.FINALIZE, "Chairman decision is not valid JSON"));

        Iterator<String> fields = parsed.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            Matcher matcher = LABELLED_KEY.matcher(field);
            if (matcher.matches()) {
                int index = Integer.parseInt(matcher.group(2));
                if (index < 1 || index > answers.size()) {
                    throw new ValidationException(Stage.FINALIZE,
                            "Chairman decided on " + field + " but only " + answers.size() + " bidders answered");
                }
            }
        }

        Map<String, Double> decisions = new LinkedHashMap<>();
        Map<String, Double> communications = new LinkedHashMap<>();
        for (int i = 0; i < answers.size(); i++) {
            String bidder = answers.get(i).modelId();
            decisions.put(bidder, required(parsed, "decision_LLM_" + (i + 1)));
            communications.put(bidder, required(parsed, "communicated_to_LLM_" + (i + 1)));
        }
        return new ChairmanDecision(chairman, decisions, communications);
    }

    private static double required(JsonNode parsed, String field) {
        OptionalDouble value = JsonReplyParser.number(parsed, field);
        if (value.isEmpty()) {
            throw new ValidationException(Stage.FINALIZE, "Chairman decision is missing " + field);
        }
        return NumberExtractor.clampPercent(value.getAsDouble());
    }

    private String buildPrompt(String userQuery, List<ModelResponse> answers,
                               ChairmanEvaluation evaluation, SelfEvaluationRound selfEvaluations) {
        String answersText = IntStream.range(0, answers.size())
                .mapToObj(i -> "LLM " + (i + 1) + ":\n" + answers.get(i).response())
                .collect(Collectors.joining("\n\n"));

        String evalText = IntStream.range(0, answers.size())
                .mapToObj(i -> comparison(i, answers.get(i).modelId(), evaluation, selfEvaluations))
                .collect(Collectors.joining(",\n"));

        String fields = IntStream.range(0, answers.size())
                .mapToObj(i -> "  \"decision_LLM_" + (i + 1) + "\": percentage from 0 to 100,\n"
                        + "  \"communicated_to_LLM_" + (i + 1) + "\": percentage from 0 to 100")
                .collect(Collectors.joining(",\n"));

        String penalty = String.format(Locale.US, "%.2f", properties.settlement().penaltyRate());

        return """
                For the following user prompt:
                <prompt>
                %s
                </prompt>

                And the following LLM answers:
                %s

                You gave this final aggregated answer:
                <aggregated_answer>
                %s
                </aggregated_answer>

                Here is your evaluation of each LLM Marginal Contribution Coefficient (probability of the user \
                preferring a given LLM answer instead of your aggregate answer) and their auto-evaluation:
                {
                %s
                }

                Now you will need to submit a final decision per LLM. Each LLM will then submit its own final claim. \
                The value you will pay per LLM is the following:
                - If your decision is lower than the LLM final claim: claim + %s x (claim - decision) \
                (note it's more than if you agreed with the claim)
                - If your decision is higher than or equal to the LLM final claim: (decision + claim) / 2

                You will also say to each LLM what was your decision, but you can choose to not say the actual decision.

                Answer in the following JSON format (no additional text):
                {
                %s
                }

                IMPORTANT: Return ONLY valid JSON, nothing else.""".formatted(
                userQuery, answersText, evaluation.aggregatedAnswer(), evalText, penalty, fields);
    }

    private String comparison(int index, String bidder, ChairmanEvaluation evaluation, SelfEvaluationRound selfEvaluations) {
        String chairmanMcc = String.format(Locale.US, "%.1f", evaluation.mccOf(bidder));
        Optional<SelfEvaluation> self = selfEvaluations.evaluationOf(bidder);
        String autoEvaluation = self
                .map(s -> """
                        {
                            "arguments": "%s",
                            "MCC": %s
                          }""".formatted(preview(s.arguments()), String.format(Locale.US, "%.1f", s.selfMcc())))
                .orElse("\"not submitted\"");
        return """
                "LLM %d": {
                  "Your MCC evaluation": %s,
                  "LLM MCC auto-evaluation": %s
                }""".formatted(index + 1, chairmanMcc, autoEvaluation);
    }

    private static String preview(String arguments) {
        if (arguments == null) {
            return "";
        }
        String flat = arguments.replace("\"", "'").replace('\n', ' ');
        return flat.length() <= ARGUMENT_PREVIEW ? flat : flat.substring(0, ARGUMENT_PREVIEW) + "...";
    }
}
