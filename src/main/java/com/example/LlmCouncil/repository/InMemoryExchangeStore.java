package com.example.LlmCouncil.repository;

import com.example.LlmCouncil.exception.ConversationNotFoundException;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationStatus;
import com.example.LlmCouncil.model.ConversationSummary;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.ExchangeFailure;
import com.example.LlmCouncil.model.Stage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local store for development and tests. Nothing survives a restart.
 */
@Repository
@ConditionalOnProperty(name = "council.store", havingValue = "memory")
public class InMemoryExchangeStore implements ExchangeStore {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExchangeStore() {
        this(Clock.systemUTC());
    }

    InMemoryExchangeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Conversation createConversation(String conversationId) {
        Conversation conversation = new Conversation(conversationId, clock.instant(), Conversation.DEFAULT_TITLE,
                ConversationStatus.IDLE, List.of());
        conversations.put(conversationId, conversation);
        return conversation;
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public List<ConversationSummary> listConversations() {
        return conversations.values().stream()
                .sorted(Comparator.comparing(Conversation::createdAt).reversed())
                .map(ConversationSummary::of)
                .toList();
    }

    @Override
    public void updateTitle(String conversationId, String title) {
        update(conversationId, c -> new Conversation(c.id(), c.createdAt(), title, c.status(), c.exchanges()));
    }

    @Override
    public void appendExchange(String conversationId, Exchange exchange) {
        update(conversationId, c -> {
            List<Exchange> exchanges = new ArrayList<>(c.exchanges());
            exchanges.add(exchange);
            return new Conversation(c.id(), c.createdAt(), c.title(), c.status(), List.copyOf(exchanges));
        });
    }

    @Override
    public Optional<Exchange> loadExchange(String conversationId) {
        return findConversation(conversationId).flatMap(Conversation::latestExchange);
    }

    @Override
    public void patchExchange(String conversationId, String exchangeId, Stage stage, Object output) {
        replaceExchange(conversationId, exchangeId, e -> e.with(stage, output));
    }

    @Override
    public void recordFailure(String conversationId, String exchangeId, ExchangeFailure failure) {
        replaceExchange(conversationId, exchangeId, e -> e.withFailure(failure));
    }

    @Override
    public boolean compareAndSetStatus(String conversationId, ConversationStatus expected, ConversationStatus next) {
        boolean[] swapped = {false};
        conversations.computeIfPresent(conversationId, (id, c) -> {
            if (c.status() != expected) {
                return c;
            }
            swapped[0] = true;
            return new Conversation(c.id(), c.createdAt(), c.title(), next, c.exchanges());
        });
        return swapped[0];
    }

    @Override
    public boolean tryAcquireRun(String conversationId, String runId, Duration lease) {
        Instant now = clock.instant();
        Lease claimed = leases.compute(conversationId, (id, current) ->
                current == null || current.expiresAt().isBefore(now) ? new Lease(runId, now.plus(lease)) : current);
        return claimed.runId().equals(runId);
    }

    @Override
    public void releaseRun(String conversationId, String runId) {
        leases.computeIfPresent(conversationId, (id, current) -> current.runId().equals(runId) ? null : current);
    }

    private void replaceExchange(String conversationId, String exchangeId, UnaryOperator<Exchange> patch) {
        update(conversationId, c -> {
            List<Exchange> exchanges = new ArrayList<>(c.exchanges());
            boolean found = false;
            for (int i = 0; i < exchanges.size(); i++) {
                if (exchanges.get(i).id().equals(exchangeId)) {
                    exchanges.set(i, patch.apply(exchanges.get(i)));
                    found = true;
                }
            }
            if (!found) {
                throw new IllegalArgumentException("Exchange " + exchangeId + " not found in conversation " + conversationId);
            }
            return new Conversation(c.id(), c.createdAt(), c.title(), c.status(), List.copyOf(exchanges));
        });
    }

    private void update(String conversationId, UnaryOperator<Conversation> change) {
        Conversation updated = conversations.computeIfPresent(conversationId, (id, c) -> change.apply(c));
        if (updated == null) {
            throw new ConversationNotFoundException(conversationId);
        }
    }

    private record Lease(String runId, Instant expiresAt) {
    }
}
