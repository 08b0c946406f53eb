package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.ModelInvocationException;
import com.example.LlmCouncil.exception.StageFatalException;
import com.example.LlmCouncil.exception.ValidationException;
import com.example.LlmCouncil.model.ChairmanEvaluation;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import com.example.LlmCouncil.model.ModelResponse;
import com.example.LlmCouncil.model.ResponseRound;
import com.example.LlmCouncil.model.Stage;
import com.example.LlmCouncil.util.JsonReplyParser;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Chairman stage one: synthesize a single answer and split 100% of the credit among the bidders.
 * <p>
 * The returned split gets one repair pass: bidders the chairman left out get 0, negative values
 * become 0, and a total outside 100 ± {@value #SUM_TOLERANCE} is rescaled to exactly 100.
 * Output that cannot be repaired is a {@link ValidationException}.
 */
@Service
@RequiredArgsConstructor
public class ChairmanAggregator {

    private static final Logger log = LoggerFactory.getLogger(ChairmanAggregator.class);

    static final double SUM_TOLERANCE = 0.5;

    private static final Pattern MCC_KEY = Pattern.compile("MCC_LLM_(\\d+)", Pattern.CASE_INSENSITIVE);

    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    public ChairmanEvaluation aggregate(String userQuery, ResponseRound responses) {
        String chairman = properties.chairman().model();
        List<ModelResponse> answers = responses.responses();

        ModelReply reply;
        try {
            reply = modelInvocationService.invoke(ModelCall.of(Stage.AGGREGATE, chairman,
                    buildPrompt(userQuery, answers), properties.chairman().maxTokens(), properties.chairman().timeout()));
        } catch (ModelInvocationException e) {
            throw new StageFatalException(Stage.AGGREGATE, "Chairman failed to aggregate: " + e.getMessage(), e);
        }

        JsonNode parsed = JsonReplyParser.parseObject(reply.text())
                .orElseThrow(() -> new ValidationException(Stage.AGGREGATE, "Chairman evaluation is not valid JSON"));

        String aggregatedAnswer = JsonReplyParser.text(parsed, "aggregated_answer")
                .orElseThrow(() -> new ValidationException(Stage.AGGREGATE, "Chairman evaluation has no aggregated_answer"));

        Map<String, Double> raw = readMccs(parsed, answers);
        ChairmanEvaluation evaluation = normalize(chairman, aggregatedAnswer, raw);
        log.info("Chairman {} credited {}{}", chairman, evaluation.mccs(),
                evaluation.renormalized() ? " (repaired from " + raw + ")" : "");
        return evaluation;
    }

    /**
     * Map "MCC_LLM_i" fields back to bidder ids. Labels beyond the surviving bidders are rejected,
     * unlabelled bidders are left out of the map.
     */
    private Map<String, Double> readMccs(JsonNode parsed, List<ModelResponse> answers) {
        Map<String, Double> raw = new LinkedHashMap<>();
        Iterator<String> fields = parsed.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            Matcher matcher = MCC_KEY.matcher(field);
            if (!matcher.matches()) {
                continue;
            }
            int index = Integer.parseInt(matcher.group(1)) - 1;
            if (index < 0 || index >= answers.size()) {
                throw new ValidationException(Stage.AGGREGATE,
                        "Chairman credited " + field + " but only " + answers.size() + " bidders answered");
            }
            OptionalDouble value = JsonReplyParser.number(parsed, field);
            if (value.isEmpty()) {
                throw new ValidationException(Stage.AGGREGATE, "Chairman value for " + field + " is not a number");
            }
            raw.put(answers.get(index).modelId(), value.getAsDouble());
        }
        // Keep bidder order and make every bidder explicit
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (ModelResponse answer : answers) {
            ordered.put(answer.modelId(), raw.get(answer.modelId()));
        }
        return ordered;
    }

    /**
     * Single repair pass over the chairman's split.
     *
     * @param raw bidder -> value as returned, null where the chairman gave none
     */
    ChairmanEvaluation normalize(String chairman, String aggregatedAnswer, Map<String, Double> raw) {
        boolean repaired = false;
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            Double value = entry.getValue();
            if (value == null || value.isNaN() || value < 0) {
                repaired = true;
                value = 0.0;
            }
            values.put(entry.getKey(), value);
        }

        double sum = values.values().stream().mapToDouble(Double::doubleValue).sum();
        if (sum <= 0.0 || Double.isInfinite(sum)) {
            throw new ValidationException(Stage.AGGREGATE, "Chairman credit split sums to " + sum + " and cannot be rescaled");
        }

        if (Math.abs(sum - 100.0) > SUM_TOLERANCE) {
            repaired = true;
            double factor = 100.0 / sum;
            values.replaceAll((bidder, value) -> value * factor);
        }

        Map<String, Double> rawCopy = new LinkedHashMap<>(raw);
        return new ChairmanEvaluation(chairman, aggregatedAnswer, values, rawCopy, repaired);
    }

    private String buildPrompt(String userQuery, List<ModelResponse> answers) {
        String answersText = IntStream.range(0, answers.size())
                .mapToObj(i -> "LLM " + (i + 1) + ":\n" + answers.get(i).response())
                .collect(Collectors.joining("\n\n"));

        String mccFields = IntStream.range(0, answers.size())
                .mapToObj(i -> "  \"MCC_LLM_" + (i + 1) + "\": percentage value between 0 and 100")
                .collect(Collectors.joining(",\n"));

        return """
                You are the chairman of an LLM council.

                Given the user prompt:
                <prompt>
                %s
                </prompt>

                And the following LLM answers:
                %s

                Produce a final aggregated answer that takes all the relevant information. And evaluate each answer \
                based on its Marginal Contribution Coefficient (MCC) (probability of the user preferring a given LLM \
                answer instead of your aggregate answer).

                The MCCs split the whole credit, so they must sum to 100.

                Answer in the following JSON format (no additional text):
                {
                  "aggregated_answer": "your comprehensive answer here",
                %s
                }

                IMPORTANT: Return ONLY valid JSON, nothing else.""".formatted(userQuery, answersText, mccFields);
    }
}
