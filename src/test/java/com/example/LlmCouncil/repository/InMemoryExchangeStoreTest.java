package com.example.LlmCouncil.repository;

import com.example.LlmCouncil.exception.ConversationNotFoundException;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationStatus;
import com.example.LlmCouncil.model.ConversationSummary;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.ExchangeFailure;
import com.example.LlmCouncil.model.PipelineState;
import com.example.LlmCouncil.model.Stage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryExchangeStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final InMemoryExchangeStore store = new InMemoryExchangeStore(clock);

    @Test
    void newConversationIsIdleWithDefaultTitle() {
        Conversation conversation = store.createConversation("c1");

        assertThat(conversation.status()).isEqualTo(ConversationStatus.IDLE);
        assertThat(conversation.title()).isEqualTo(Conversation.DEFAULT_TITLE);
        assertThat(store.findConversation("c1")).isPresent();
        assertThat(store.findConversation("missing")).isEmpty();
    }

    @Test
    void statusCompareAndSetOnlySucceedsFromExpected() {
        store.createConversation("c1");

        assertThat(store.compareAndSetStatus("c1", ConversationStatus.IDLE, ConversationStatus.PROCESSING)).isTrue();
        assertThat(store.compareAndSetStatus("c1", ConversationStatus.IDLE, ConversationStatus.PROCESSING)).isFalse();
        assertThat(store.compareAndSetStatus("missing", ConversationStatus.IDLE, ConversationStatus.PROCESSING)).isFalse();
        assertThat(store.findConversation("c1").orElseThrow().status()).isEqualTo(ConversationStatus.PROCESSING);
    }

    @Test
    void concurrentStatusTransitionsHaveExactlyOneWinner() throws Exception {
        store.createConversation("c1");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = IntStream.range(0, 32)
                    .<Callable<Boolean>>mapToObj(i -> () ->
                            store.compareAndSetStatus("c1", ConversationStatus.IDLE, ConversationStatus.PROCESSING))
                    .toList();

            long winners = 0;
            for (Future<Boolean> result : pool.invokeAll(attempts)) {
                if (result.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void runLeaseIsExclusiveUntilReleasedOrExpired() {
        store.createConversation("c1");

        assertThat(store.tryAcquireRun("c1", "run-1", Duration.ofMinutes(1))).isTrue();
        assertThat(store.tryAcquireRun("c1", "run-2", Duration.ofMinutes(1))).isFalse();

        store.releaseRun("c1", "run-2");
        assertThat(store.tryAcquireRun("c1", "run-2", Duration.ofMinutes(1))).isFalse();

        store.releaseRun("c1", "run-1");
        assertThat(store.tryAcquireRun("c1", "run-2", Duration.ofMinutes(1))).isTrue();

        clock.advance(Duration.ofMinutes(2));
        assertThat(store.tryAcquireRun("c1", "run-3", Duration.ofMinutes(1))).isTrue();
    }

    @Test
    void patchesAccumulateOnTheLatestExchange() {
        store.createConversation("c1");
        store.appendExchange("c1", Exchange.start("e1", "first", clock.instant()));
        store.appendExchange("c1", Exchange.start("e2", "second", clock.instant()));

        AuctionResult auction = new AuctionResult(List.of(), List.of("m/a"), List.of(), 0.01);
        store.patchExchange("c1", "e2", Stage.QUOTE, auction);

        Exchange latest = store.loadExchange("c1").orElseThrow();
        assertThat(latest.id()).isEqualTo("e2");
        assertThat(latest.auction()).isEqualTo(auction);
        assertThat(latest.nextStage()).contains(Stage.RESPOND);
        assertThat(latest.state()).isEqualTo(PipelineState.RESPONDING);
    }

    @Test
    void failureMarkerCanBeSetAndCleared() {
        store.createConversation("c1");
        store.appendExchange("c1", Exchange.start("e1", "q", clock.instant()));

        store.recordFailure("c1", "e1", new ExchangeFailure("aggregate", "chairman down", clock.instant()));
        assertThat(store.loadExchange("c1").orElseThrow().state()).isEqualTo(PipelineState.FAILED);

        store.recordFailure("c1", "e1", null);
        assertThat(store.loadExchange("c1").orElseThrow().failure()).isNull();
    }

    @Test
    void patchingAStageWithTheWrongPayloadIsRejected() {
        store.createConversation("c1");
        store.appendExchange("c1", Exchange.start("e1", "q", clock.instant()));

        assertThatThrownBy(() -> store.patchExchange("c1", "e1", Stage.SETTLE, "not a settlement"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownConversationCannotBeUpdated() {
        assertThatThrownBy(() -> store.appendExchange("missing", Exchange.start("e1", "q", clock.instant())))
                .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    void listsNewestFirst() {
        store.createConversation("old");
        clock.advance(Duration.ofSeconds(5));
        store.createConversation("new");
        store.appendExchange("new", Exchange.start("e1", "q", clock.instant()));

        List<ConversationSummary> summaries = store.listConversations();

        assertThat(summaries).extracting(ConversationSummary::id).containsExactly("new", "old");
        assertThat(summaries.get(0).messageCount()).isEqualTo(1);
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
