package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.ConversationBusyException;
import com.example.LlmCouncil.exception.StageFatalException;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.ChairmanDecision;
import com.example.LlmCouncil.model.ChairmanEvaluation;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationStatus;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.ExchangeFailure;
import com.example.LlmCouncil.model.FinalClaimRound;
import com.example.LlmCouncil.model.SelfEvaluationRound;
import com.example.LlmCouncil.model.Settlement;
import com.example.LlmCouncil.model.Stage;
import com.example.LlmCouncil.model.StageEvent;
import com.example.LlmCouncil.repository.ExchangeStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives an exchange through the seven council stages.
 * <p>
 * Stages run strictly one after another on the pipeline executor. Each stage output is
 * checkpointed before its "complete" event is emitted, and a resumed run starts at the first
 * stage without a checkpoint. When the subscriber goes away the in-flight stage still finishes
 * and is checkpointed; the run then stops before the next stage.
 */
@Service
@RequiredArgsConstructor
public class CouncilPipeline {

    private static final Logger log = LoggerFactory.getLogger(CouncilPipeline.class);

    private static final int STAGE_COUNT = Stage.values().length;

    private final ExchangeStore exchangeStore;
    private final ConversationService conversationService;
    private final TokenAuctionService tokenAuctionService;
    private final ResponseCollector responseCollector;
    private final ChairmanAggregator chairmanAggregator;
    private final SelfEvaluationCollector selfEvaluationCollector;
    private final ChairmanFinalizer chairmanFinalizer;
    private final FinalAcceptanceCollector finalAcceptanceCollector;
    private final PaymentSettlement paymentSettlement;
    private final TitleGenerator titleGenerator;
    private final SettlementLogService settlementLogService;
    private final CouncilProperties properties;
    private final ExecutorService pipelineExecutor;

    /**
     * Start a new exchange for {@code question}.
     *
     * @throws com.example.LlmCouncil.exception.ConversationNotFoundException if the conversation does not exist
     * @throws ConversationBusyException if the conversation is not idle
     */
    public Flux<StageEvent> submit(String conversationId, String question) {
        Conversation conversation = conversationService.get(conversationId);

        if (!exchangeStore.compareAndSetStatus(conversationId, ConversationStatus.IDLE, ConversationStatus.PROCESSING)) {
            throw new ConversationBusyException("Conversation " + conversationId
                    + " is processing; resume it before sending a new message");
        }

        String runId = UUID.randomUUID().toString();
        if (!exchangeStore.tryAcquireRun(conversationId, runId, properties.pipeline().runLease())) {
            exchangeStore.compareAndSetStatus(conversationId, ConversationStatus.PROCESSING, ConversationStatus.IDLE);
            throw new ConversationBusyException("Conversation " + conversationId + " already has an active run");
        }

        Exchange exchange = Exchange.start(UUID.randomUUID().toString(), question, Instant.now());
        try {
            exchangeStore.appendExchange(conversationId, exchange);
        } catch (RuntimeException e) {
            exchangeStore.releaseRun(conversationId, runId);
            exchangeStore.compareAndSetStatus(conversationId, ConversationStatus.PROCESSING, ConversationStatus.IDLE);
            throw e;
        }

        CompletableFuture<String> title = conversation.exchanges().isEmpty()
                ? CompletableFuture.supplyAsync(() -> titleGenerator.generate(question), pipelineExecutor)
                : null;

        String context = conversationService.renderHistory(conversation, exchange.id());
        log.info("Conversation {}: new exchange {}", conversationId, exchange.id());
        return run(conversationId, runId, exchange, context, title);
    }

    /**
     * Continue the latest unfinished exchange from its last checkpoint.
     *
     * @throws ConversationBusyException if there is nothing to resume or another run holds the conversation
     */
    public Flux<StageEvent> resume(String conversationId) {
        Conversation conversation = conversationService.get(conversationId);

        Exchange exchange = conversation.latestExchange()
                .filter(e -> conversation.status() == ConversationStatus.PROCESSING)
                .orElseThrow(() -> new ConversationBusyException(
                        "Conversation " + conversationId + " has no unfinished exchange to resume"));

        String runId = UUID.randomUUID().toString();
        if (!exchangeStore.tryAcquireRun(conversationId, runId, properties.pipeline().runLease())) {
            throw new ConversationBusyException("Conversation " + conversationId + " already has an active run");
        }

        String context = conversationService.renderHistory(conversation, exchange.id());
        log.info("Conversation {}: resuming exchange {} at {}", conversationId, exchange.id(),
                exchange.nextStage().map(Stage::key).orElse("completion"));
        return run(conversationId, runId, exchange, context, null);
    }

    private Flux<StageEvent> run(String conversationId, String runId, Exchange exchange, String context,
                                 CompletableFuture<String> title) {
        return Flux.create(sink -> {
            AtomicBoolean cancelled = new AtomicBoolean(false);
            sink.onCancel(() -> cancelled.set(true));
            try {
                pipelineExecutor.execute(() -> drive(conversationId, runId, exchange, context, title, sink, cancelled));
            } catch (RejectedExecutionException e) {
                exchangeStore.releaseRun(conversationId, runId);
                sink.error(e);
            }
        });
    }

    /**
     * Blocking run loop. Only ever executed by one thread per conversation, guarded by the run lease.
     */
    void drive(String conversationId, String runId, Exchange start, String context,
               CompletableFuture<String> title, FluxSink<StageEvent> sink, AtomicBoolean cancelled) {
        Exchange exchange = start;
        Stage current = null;
        try {
            if (exchange.failure() != null) {
                exchangeStore.recordFailure(conversationId, exchange.id(), null);
                exchange = exchange.withFailure(null);
            }

            boolean settledInThisRun = false;
            for (Stage stage : Stage.values()) {
                if (exchange.isCompleted(stage)) {
                    continue;
                }
                if (cancelled.get()) {
                    log.info("Conversation {}: subscriber left, stopping before {} (resume to continue)",
                            conversationId, stage.key());
                    applyTitle(conversationId, title, null);
                    return;
                }

                current = stage;
                log.info("[{}/{}] {} for exchange {}", stage.number(), STAGE_COUNT, stage.key(), exchange.id());
                sink.next(StageEvent.started(stage));

                Object output = execute(stage, exchange, context);
                exchangeStore.patchExchange(conversationId, exchange.id(), stage, output);
                exchange = exchange.with(stage, output);
                sink.next(StageEvent.completed(stage, rounded(output)));

                settledInThisRun |= stage == Stage.SETTLE;
            }
            current = null;

            if (settledInThisRun) {
                recordSettlement(conversationId, exchange);
            }
            applyTitle(conversationId, title, sink);
            exchangeStore.compareAndSetStatus(conversationId, ConversationStatus.PROCESSING, ConversationStatus.IDLE);

            log.info("Conversation {}: exchange {} done", conversationId, exchange.id());
            sink.next(StageEvent.finished(conversationId, exchange.id()));
            sink.complete();
        } catch (StageFatalException e) {
            log.warn("Conversation {}: stage {} failed: {}", conversationId, e.getStage().key(), e.getMessage());
            fail(conversationId, exchange, e.getStage(), e.getMessage(), title, sink);
        } catch (RuntimeException e) {
            log.error("Conversation {}: unexpected error in stage {}", conversationId,
                    current == null ? "completion" : current.key(), e);
            fail(conversationId, exchange, current, String.valueOf(e.getMessage()), title, sink);
        } finally {
            exchangeStore.releaseRun(conversationId, runId);
        }
    }

    private Object execute(Stage stage, Exchange exchange, String context) {
        String question = exchange.question();
        return switch (stage) {
            case QUOTE -> tokenAuctionService.runAuction(question);
            case RESPOND -> responseCollector.collect(question, exchange.auction(), context);
            case AGGREGATE -> chairmanAggregator.aggregate(question, exchange.responses());
            case SELF_EVALUATE -> selfEvaluationCollector.collect(question, exchange.responses(),
                    exchange.evaluation(), exchange.auction());
            case FINALIZE -> chairmanFinalizer.finalizeDecisions(question, exchange.responses(),
                    exchange.evaluation(), exchange.selfEvaluations());
            case ACCEPT -> finalAcceptanceCollector.collect(question, exchange.responses(), exchange.decision());
            case SETTLE -> paymentSettlement.settle(exchange.auction(), exchange.decision(),
                    exchange.selfEvaluations(), exchange.claims());
        };
    }

    /**
     * Event payloads carry boundary-rounded values; checkpoints keep full precision.
     */
    static Object rounded(Object output) {
        if (output instanceof AuctionResult auction) {
            return auction.rounded();
        }
        if (output instanceof ChairmanEvaluation evaluation) {
            return evaluation.rounded();
        }
        if (output instanceof SelfEvaluationRound round) {
            return round.rounded();
        }
        if (output instanceof ChairmanDecision decision) {
            return decision.rounded();
        }
        if (output instanceof FinalClaimRound claims) {
            return claims.rounded();
        }
        if (output instanceof Settlement settlement) {
            return settlement.rounded();
        }
        return output;
    }

    private void fail(String conversationId, Exchange exchange, Stage stage, String message,
                      CompletableFuture<String> title, FluxSink<StageEvent> sink) {
        try {
            exchangeStore.recordFailure(conversationId, exchange.id(),
                    new ExchangeFailure(stage == null ? null : stage.key(), message, Instant.now()));
        } catch (RuntimeException storeError) {
            log.error("Conversation {}: could not record failure marker", conversationId, storeError);
        }
        applyTitle(conversationId, title, null);
        sink.next(StageEvent.failed(stage, message));
        sink.complete();
    }

    private void recordSettlement(String conversationId, Exchange exchange) {
        try {
            settlementLogService.recordSettlement(conversationId, exchange);
        } catch (RuntimeException e) {
            // The checkpoint is authoritative; the audit row is best effort
            log.warn("Conversation {}: failed to write settlement log for exchange {}", conversationId, exchange.id(), e);
        }
    }

    /**
     * @param sink receives a title event when given, null to only store the title
     */
    private void applyTitle(String conversationId, CompletableFuture<String> title, FluxSink<StageEvent> sink) {
        if (title == null) {
            return;
        }
        try {
            String generated = title.join();
            if (Conversation.DEFAULT_TITLE.equals(generated)) {
                return;
            }
            exchangeStore.updateTitle(conversationId, generated);
            if (sink != null) {
                sink.next(StageEvent.titled(generated));
            }
        } catch (RuntimeException e) {
            log.warn("Conversation {}: title not updated: {}", conversationId, e.getMessage());
        }
    }
}
