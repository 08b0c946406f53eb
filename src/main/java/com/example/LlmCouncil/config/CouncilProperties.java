package com.example.LlmCouncil.config;

import com.example.LlmCouncil.model.CandidateModel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the council pipeline.
 */
@ConfigurationProperties(prefix = "council")
public record CouncilProperties(
        Auction auction,
        Invocation invocation,
        Chairman chairman,
        Settlement settlement,
        Pipeline pipeline,
        Title title,
        Store store,
        List<CandidateModel> catalog
) {

    public CouncilProperties {
        auction = auction != null ? auction : new Auction(null, null, null, null);
        invocation = invocation != null ? invocation : new Invocation(null, null, null);
        chairman = chairman != null ? chairman : new Chairman(null, null, null);
        settlement = settlement != null ? settlement : new Settlement(null, null);
        pipeline = pipeline != null ? pipeline : new Pipeline(null, null);
        title = title != null ? title : new Title(null, null, null);
        store = store != null ? store : Store.REDIS;
        catalog = catalog != null ? List.copyOf(catalog) : List.of();
    }

    /**
     * Token auction settings.
     *
     * @param bidderCount         size k of the bidder set
     * @param askBidders          ask each candidate for its token quote; when false quotes are estimated locally
     * @param defaultQuotedTokens token count used when a reply cannot be parsed or quotes are estimated
     * @param quoteTimeout        per-candidate timeout of the quote call
     */
    public record Auction(Integer bidderCount, Boolean askBidders, Integer defaultQuotedTokens, Duration quoteTimeout) {
        public Auction {
            bidderCount = bidderCount != null && bidderCount > 0 ? bidderCount : 3;
            askBidders = askBidders == null || askBidders;
            defaultQuotedTokens = defaultQuotedTokens != null && defaultQuotedTokens > 0 ? defaultQuotedTokens : 1500;
            quoteTimeout = quoteTimeout != null ? quoteTimeout : Duration.ofSeconds(60);
        }
    }

    /**
     * Bidder call settings for the three fan-out stages.
     */
    public record Invocation(Duration bidderTimeout, Integer selfEvaluationMaxTokens, Integer finalAcceptanceMaxTokens) {
        public Invocation {
            bidderTimeout = bidderTimeout != null ? bidderTimeout : Duration.ofSeconds(120);
            selfEvaluationMaxTokens = selfEvaluationMaxTokens != null ? selfEvaluationMaxTokens : 2048;
            finalAcceptanceMaxTokens = finalAcceptanceMaxTokens != null ? finalAcceptanceMaxTokens : 256;
        }
    }

    /**
     * @param model     chairman model id
     * @param maxTokens completion budget of a chairman call
     * @param timeout   timeout of a chairman call
     */
    public record Chairman(String model, Integer maxTokens, Duration timeout) {
        public Chairman {
            model = model != null && !model.isBlank() ? model : "google/gemini-3-pro-preview";
            maxTokens = maxTokens != null ? maxTokens : 8192;
            timeout = timeout != null ? timeout : Duration.ofSeconds(240);
        }
    }

    /**
     * @param penaltyRate      share of the claim gap charged to both sides when the chairman under-commits
     * @param contractValueUsd fixed value basis; when null the selected quotes' estimated costs are used
     */
    public record Settlement(Double penaltyRate, Double contractValueUsd) {
        public Settlement {
            penaltyRate = penaltyRate != null ? penaltyRate : 0.2;
        }
    }

    /**
     * @param runLease        how long a run may hold a conversation before another resume can claim it
     * @param historyMessages prior messages passed to bidders as conversation context
     */
    public record Pipeline(Duration runLease, Integer historyMessages) {
        public Pipeline {
            runLease = runLease != null ? runLease : Duration.ofMinutes(30);
            historyMessages = historyMessages != null ? historyMessages : 8;
        }
    }

    /**
     * Conversation title generated from the first question.
     *
     * @param enabled ask a model for a title; when false conversations keep the default title
     * @param model   small, fast model used for titles
     * @param timeout timeout of the title call
     */
    public record Title(Boolean enabled, String model, Duration timeout) {
        public Title {
            enabled = enabled == null || enabled;
            model = model != null && !model.isBlank() ? model : "google/gemini-2.5-flash";
            timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        }
    }

    public enum Store {
        REDIS,
        MEMORY
    }
}
