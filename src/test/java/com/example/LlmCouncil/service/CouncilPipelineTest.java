package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.ConversationBusyException;
import com.example.LlmCouncil.exception.ConversationNotFoundException;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.CandidateModel;
import com.example.LlmCouncil.model.ChairmanEvaluation;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationStatus;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelResponse;
import com.example.LlmCouncil.model.PaymentRecord;
import com.example.LlmCouncil.model.PipelineState;
import com.example.LlmCouncil.model.Quote;
import com.example.LlmCouncil.model.ResponseRound;
import com.example.LlmCouncil.model.Settlement;
import com.example.LlmCouncil.model.Stage;
import com.example.LlmCouncil.model.StageEvent;
import com.example.LlmCouncil.repository.InMemoryExchangeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class CouncilPipelineTest {

    private static final double EPS = 1e-9;
    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final String CHAIRMAN = TestProperties.CHAIRMAN;

    // Output prices chosen so that a 1000 token quote costs 1..5 cents
    private static final List<CandidateModel> CATALOG = List.of(
            new CandidateModel("m/a", 0.0, 10.0),
            new CandidateModel("m/b", 0.0, 20.0),
            new CandidateModel("m/c", 0.0, 30.0),
            new CandidateModel("m/d", 0.0, 40.0),
            new CandidateModel("m/e", 0.0, 50.0));

    private final ScriptedModels models = new ScriptedModels();
    private final InMemoryExchangeStore store = new InMemoryExchangeStore();
    private final SettlementLogService settlementLogService = mock(SettlementLogService.class);
    private ExecutorService executor;
    private CouncilPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        pipeline = pipeline(TestProperties.withCatalog(CATALOG));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsAllStagesAndSettlesTheWorkedExample() {
        scriptHappyPath();
        String conversationId = store.createConversation("c1").id();

        List<StageEvent> events = pipeline.submit(conversationId, "Explain token auctions").collectList().block(WAIT);

        assertThat(events).extracting(StageEvent::type).containsExactly(
                "quote_start", "quote_complete",
                "respond_start", "respond_complete",
                "aggregate_start", "aggregate_complete",
                "self_evaluate_start", "self_evaluate_complete",
                "finalize_start", "finalize_complete",
                "accept_start", "accept_complete",
                "settle_start", "settle_complete",
                "complete");
        assertThat(events).allSatisfy(e -> assertThat(e.schemaVersion()).isEqualTo(StageEvent.SCHEMA_VERSION));

        AuctionResult auction = (AuctionResult) events.get(1).data();
        assertThat(auction.bidders()).containsExactly("m/a", "m/b", "m/c");

        Settlement settlement = (Settlement) events.get(13).data();
        assertPayment(settlement.paymentFor("m/a").orElseThrow(), 61.0, 54.0);
        assertPayment(settlement.paymentFor("m/b").orElseThrow(), 22.5, 22.5);
        assertPayment(settlement.paymentFor("m/c").orElseThrow(), 26.0, 19.0);
        assertThat(settlement.valueBasisUsd()).isCloseTo(0.06, within(EPS));
        assertThat(settlement.chairmanEarningsMcc()).isEqualTo(4.5);
        assertThat(settlement.paymentFor("m/a").orElseThrow().selfEvaluationMcc()).isEqualTo(65.0);

        Conversation conversation = store.findConversation(conversationId).orElseThrow();
        assertThat(conversation.status()).isEqualTo(ConversationStatus.IDLE);
        Exchange exchange = conversation.latestExchange().orElseThrow();
        assertThat(exchange.state()).isEqualTo(PipelineState.DONE);
        assertThat(exchange.decision().decisionFor("m/a")).isEqualTo(55.0);
        assertThat(exchange.decision().communicationFor("m/a")).isEqualTo(50.0);
        verify(settlementLogService).recordSettlement(eq(conversationId), any(Exchange.class));
    }

    @Test
    void resumeFromAggregateCheckpointSkipsAuctionAndResponses() {
        scriptHappyPath();
        String conversationId = store.createConversation("c1").id();
        store.compareAndSetStatus(conversationId, ConversationStatus.IDLE, ConversationStatus.PROCESSING);
        store.appendExchange(conversationId, checkpointedAtAggregate());

        List<StageEvent> events = pipeline.resume(conversationId).collectList().block(WAIT);

        assertThat(events).extracting(StageEvent::type).startsWith("self_evaluate_start").endsWith("complete");
        assertThat(models.calls(Stage.QUOTE)).isEmpty();
        assertThat(models.calls(Stage.RESPOND)).isEmpty();
        assertThat(models.calls(Stage.AGGREGATE)).isEmpty();
        assertThat(models.calls(Stage.SELF_EVALUATE)).hasSize(3);
        assertThat(store.findConversation(conversationId).orElseThrow().status()).isEqualTo(ConversationStatus.IDLE);
    }

    @Test
    void chairmanFailureStopsTheRunAndResumeRetriesOnlyThatStage() {
        scriptHappyPath();
        models.when(Stage.FINALIZE, CHAIRMAN).fail("provider unavailable");
        String conversationId = store.createConversation("c1").id();

        List<StageEvent> failed = pipeline.submit(conversationId, "q").collectList().block(WAIT);

        StageEvent last = failed.get(failed.size() - 1);
        assertThat(last.type()).isEqualTo(StageEvent.ERROR);
        assertThat(last.stage()).isEqualTo("finalize");
        assertThat(last.message()).contains("provider unavailable");
        assertThat(failed).extracting(StageEvent::type).doesNotContain("finalize_complete", StageEvent.COMPLETE);

        Conversation conversation = store.findConversation(conversationId).orElseThrow();
        assertThat(conversation.status()).isEqualTo(ConversationStatus.PROCESSING);
        Exchange stopped = conversation.latestExchange().orElseThrow();
        assertThat(stopped.isCompleted(Stage.SELF_EVALUATE)).isTrue();
        assertThat(stopped.failure().stage()).isEqualTo("finalize");
        assertThat(stopped.state()).isEqualTo(PipelineState.FAILED);

        assertThatThrownBy(() -> pipeline.submit(conversationId, "another question"))
                .isInstanceOf(ConversationBusyException.class);

        models.clearCalls();
        scriptFinalize();
        List<StageEvent> resumed = pipeline.resume(conversationId).collectList().block(WAIT);

        assertThat(resumed).extracting(StageEvent::type).startsWith("finalize_start").endsWith("complete");
        assertThat(models.calls()).extracting(ModelCall::stage)
                .doesNotContain(Stage.QUOTE, Stage.RESPOND, Stage.AGGREGATE, Stage.SELF_EVALUATE);
        Exchange done = store.loadExchange(conversationId).orElseThrow();
        assertThat(done.failure()).isNull();
        assertThat(done.isSettled()).isTrue();
    }

    @Test
    void bidderFailingToRespondIsAbsentFromEveryLaterStage() {
        scriptQuotes();
        models.when(Stage.RESPOND, "m/a").reply("answer a")
                .when(Stage.RESPOND, "m/b").fail("timed out")
                .when(Stage.RESPOND, "m/c").reply("answer c")
                .when(Stage.AGGREGATE, CHAIRMAN).reply("""
                        {"aggregated_answer": "combined", "MCC_LLM_1": 60, "MCC_LLM_2": 40}""")
                .when(Stage.SELF_EVALUATE, "m/a").reply("{\"arguments\": \"a\", \"MCC\": 65}")
                .when(Stage.SELF_EVALUATE, "m/c").reply("{\"arguments\": \"c\", \"MCC\": 45}")
                .when(Stage.FINALIZE, CHAIRMAN).reply("""
                        {"decision_LLM_1": 60, "communicated_to_LLM_1": 60,
                         "decision_LLM_2": 40, "communicated_to_LLM_2": 40}""")
                .when(Stage.ACCEPT, "m/a").reply("60")
                .when(Stage.ACCEPT, "m/c").reply("40");
        String conversationId = store.createConversation("c1").id();

        List<StageEvent> events = pipeline.submit(conversationId, "q").collectList().block(WAIT);

        assertThat(events).extracting(StageEvent::type).endsWith("complete");
        Exchange exchange = store.loadExchange(conversationId).orElseThrow();
        assertThat(exchange.responses().dropped()).containsExactly("m/b");
        assertThat(exchange.evaluation().mccs()).containsOnlyKeys("m/a", "m/c");
        assertThat(exchange.selfEvaluations().evaluationOf("m/b")).isEmpty();
        assertThat(exchange.decision().decisions()).containsOnlyKeys("m/a", "m/c");
        assertThat(exchange.claims().claims()).noneMatch(c -> c.modelId().equals("m/b"));
        assertThat(exchange.settlement().paymentFor("m/b")).isEmpty();
        assertThat(models.calls()).filteredOn(c -> c.stage() != Stage.QUOTE && c.stage() != Stage.RESPOND)
                .noneMatch(c -> c.modelId().equals("m/b"));
    }

    @Test
    void bidderWithoutSelfEvaluationStaysEligible() {
        scriptHappyPath();
        models.when(Stage.SELF_EVALUATE, "m/c").fail("timeout");
        String conversationId = store.createConversation("c1").id();

        pipeline.submit(conversationId, "q").collectList().block(WAIT);

        Exchange exchange = store.loadExchange(conversationId).orElseThrow();
        assertThat(exchange.selfEvaluations().absent()).containsExactly("m/c");
        assertThat(exchange.settlement().paymentFor("m/c")).isPresent();
        assertThat(exchange.settlement().paymentFor("m/c").orElseThrow().selfEvaluationMcc()).isNull();
    }

    @Test
    void unknownConversationIsRejectedBeforeAnyCall() {
        assertThatThrownBy(() -> pipeline.submit("missing", "q")).isInstanceOf(ConversationNotFoundException.class);
        assertThatThrownBy(() -> pipeline.resume("missing")).isInstanceOf(ConversationNotFoundException.class);
        assertThat(models.calls()).isEmpty();
    }

    @Test
    void idleConversationHasNothingToResume() {
        String conversationId = store.createConversation("c1").id();

        assertThatThrownBy(() -> pipeline.resume(conversationId)).isInstanceOf(ConversationBusyException.class);
    }

    @Test
    void resumeIsRefusedWhileAnotherRunHoldsTheConversation() {
        String conversationId = store.createConversation("c1").id();
        store.compareAndSetStatus(conversationId, ConversationStatus.IDLE, ConversationStatus.PROCESSING);
        store.appendExchange(conversationId, checkpointedAtAggregate());
        store.tryAcquireRun(conversationId, "other-run", Duration.ofMinutes(5));

        assertThatThrownBy(() -> pipeline.resume(conversationId)).isInstanceOf(ConversationBusyException.class);
    }

    @Test
    void disconnectFinishesAndCheckpointsTheInFlightStageThenStops() throws Exception {
        scriptHappyPath();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        models.when(Stage.RESPOND, "m/a").replyWith(call -> {
            entered.countDown();
            awaitQuietly(release);
            return "answer a";
        });
        String conversationId = store.createConversation("c1").id();

        Disposable subscription = pipeline.submit(conversationId, "q").subscribe();
        assertThat(entered.await(WAIT.toSeconds(), TimeUnit.SECONDS)).isTrue();
        subscription.dispose();
        release.countDown();

        waitUntil(() -> {
            boolean free = store.tryAcquireRun(conversationId, "probe", Duration.ofSeconds(1));
            if (free) {
                store.releaseRun(conversationId, "probe");
            }
            return free;
        });

        Exchange exchange = store.loadExchange(conversationId).orElseThrow();
        assertThat(exchange.isCompleted(Stage.RESPOND)).isTrue();
        assertThat(exchange.isCompleted(Stage.AGGREGATE)).isFalse();
        assertThat(models.calls(Stage.AGGREGATE)).isEmpty();
        assertThat(store.findConversation(conversationId).orElseThrow().status()).isEqualTo(ConversationStatus.PROCESSING);
        verify(settlementLogService, never()).recordSettlement(any(), any());
    }

    @Test
    void laterMessagesCarryEarlierExchangesAsContext() {
        scriptHappyPath();
        String conversationId = store.createConversation("c1").id();

        pipeline.submit(conversationId, "first question").collectList().block(WAIT);
        models.clearCalls();
        pipeline.submit(conversationId, "second question").collectList().block(WAIT);

        assertThat(models.calls(Stage.RESPOND)).allSatisfy(call -> assertThat(call.context())
                .isEqualTo("user: first question\nassistant: combined answer"));
        assertThat(store.findConversation(conversationId).orElseThrow().exchanges()).hasSize(2);
    }

    @Test
    void firstMessageNamesTheConversation() {
        CouncilProperties titled = new CouncilProperties(null, null,
                new CouncilProperties.Chairman(CHAIRMAN, null, null), null, null,
                new CouncilProperties.Title(true, "m/title", null),
                CouncilProperties.Store.MEMORY, CATALOG);
        CouncilPipeline titledPipeline = pipeline(titled);
        scriptHappyPath();
        models.when(null, "m/title").reply("\"Token Auction Basics\"");
        String conversationId = store.createConversation("c1").id();

        List<StageEvent> events = titledPipeline.submit(conversationId, "q").collectList().block(WAIT);

        assertThat(events).extracting(StageEvent::type).endsWith(StageEvent.TITLE_COMPLETE, StageEvent.COMPLETE);
        assertThat(store.findConversation(conversationId).orElseThrow().title()).isEqualTo("Token Auction Basics");
    }

    @Test
    void eventPayloadsAreRoundedButCheckpointsAreNot() {
        scriptHappyPath();
        models.when(Stage.AGGREGATE, CHAIRMAN).reply("""
                {"aggregated_answer": "combined answer", "MCC_LLM_1": 1, "MCC_LLM_2": 1, "MCC_LLM_3": 1}""");
        String conversationId = store.createConversation("c1").id();

        List<StageEvent> events = pipeline.submit(conversationId, "q").collectList().block(WAIT);

        ChairmanEvaluation emitted = (ChairmanEvaluation) events.stream()
                .filter(e -> e.type().equals("aggregate_complete")).findFirst().orElseThrow().data();
        assertThat(emitted.mccOf("m/a")).isEqualTo(33.3);
        assertThat(store.loadExchange(conversationId).orElseThrow().evaluation().mccOf("m/a"))
                .isCloseTo(100.0 / 3, within(EPS));
    }

    private CouncilPipeline pipeline(CouncilProperties properties) {
        ConversationService conversationService = new ConversationService(store, properties);
        return new CouncilPipeline(
                store,
                conversationService,
                new TokenAuctionService(new ConfiguredPricingCatalog(properties), models, properties),
                new ResponseCollector(models, properties),
                new ChairmanAggregator(models, properties),
                new SelfEvaluationCollector(models, properties),
                new ChairmanFinalizer(models, properties),
                new FinalAcceptanceCollector(models, properties),
                new PaymentSettlement(properties),
                new TitleGenerator(models, properties),
                settlementLogService,
                properties,
                executor);
    }

    private void scriptQuotes() {
        CATALOG.forEach(c -> models.when(Stage.QUOTE, c.modelId()).reply("1000"));
    }

    private void scriptHappyPath() {
        scriptQuotes();
        models.when(Stage.RESPOND, "m/a").reply("answer a")
                .when(Stage.RESPOND, "m/b").reply("answer b")
                .when(Stage.RESPOND, "m/c").reply("answer c")
                .when(Stage.AGGREGATE, CHAIRMAN).reply("""
                        {"aggregated_answer": "combined answer", "MCC_LLM_1": 50, "MCC_LLM_2": 30, "MCC_LLM_3": 20}""")
                .when(Stage.SELF_EVALUATE, "m/a").reply("{\"arguments\": \"depth\", \"MCC\": 65}")
                .when(Stage.SELF_EVALUATE, "m/b").reply("{\"arguments\": \"clarity\", \"MCC\": 25}")
                .when(Stage.SELF_EVALUATE, "m/c").reply("{\"arguments\": \"examples\", \"MCC\": 30}")
                .when(Stage.ACCEPT, "m/a").reply("60")
                .when(Stage.ACCEPT, "m/b").reply("20")
                .when(Stage.ACCEPT, "m/c").reply("25");
        scriptFinalize();
    }

    private void scriptFinalize() {
        models.when(Stage.FINALIZE, CHAIRMAN).reply("""
                {"decision_LLM_1": 55, "communicated_to_LLM_1": 50,
                 "decision_LLM_2": 25, "communicated_to_LLM_2": 30,
                 "decision_LLM_3": 20, "communicated_to_LLM_3": 20}""");
    }

    private static Exchange checkpointedAtAggregate() {
        AuctionResult auction = new TokenAuctionService(null, null, TestProperties.withCatalog(CATALOG)).select(
                List.of(
                        new Quote("m/a", 1000, 10, 0.0, 10.0, 0.01, false, "1000"),
                        new Quote("m/b", 1000, 10, 0.0, 20.0, 0.02, false, "1000"),
                        new Quote("m/c", 1000, 10, 0.0, 30.0, 0.03, false, "1000")),
                List.of(), 3);
        ResponseRound responses = new ResponseRound(List.of(
                new ModelResponse("m/a", "answer a", null),
                new ModelResponse("m/b", "answer b", null),
                new ModelResponse("m/c", "answer c", null)), List.of());
        ChairmanEvaluation evaluation = new ChairmanEvaluation(CHAIRMAN, "combined answer",
                Map.of("m/a", 50.0, "m/b", 30.0, "m/c", 20.0), Map.of("m/a", 50.0, "m/b", 30.0, "m/c", 20.0), false);
        return Exchange.start("e1", "q", Instant.now())
                .with(Stage.QUOTE, auction)
                .with(Stage.RESPOND, responses)
                .with(Stage.AGGREGATE, evaluation);
    }

    private static void assertPayment(PaymentRecord payment, double chairmanPays, double bidderReceives) {
        assertThat(payment.chairmanPaysMcc()).isCloseTo(chairmanPays, within(EPS));
        assertThat(payment.bidderReceivesMcc()).isCloseTo(bidderReceives, within(EPS));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(WAIT.toSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + WAIT);
            }
            Thread.sleep(20);
        }
    }
}
