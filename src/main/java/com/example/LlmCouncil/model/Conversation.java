package com.example.LlmCouncil.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record Conversation(
        String id,
        Instant createdAt,
        String title,
        ConversationStatus status,
        List<Exchange> exchanges
) {

    public static final String DEFAULT_TITLE = "New Conversation";

    /**
     * Copy for API responses, with percentages and currency rounded like stage events.
     */
    public Conversation rounded() {
        return new Conversation(id, createdAt, title, status, exchanges.stream().map(Exchange::rounded).toList());
    }

    public Optional<Exchange> latestExchange() {
        return exchanges.isEmpty() ? Optional.empty() : Optional.of(exchanges.get(exchanges.size() - 1));
    }
}
