package com.example.LlmCouncil.model;

import java.time.Instant;

/**
 * Conversation metadata for list views.
 *
 * @param messageCount user and assistant messages, two per exchange once settled
 */
public record ConversationSummary(
        String id,
        Instant createdAt,
        String title,
        ConversationStatus status,
        int messageCount
) {

    public static ConversationSummary of(Conversation conversation) {
        int messages = 0;
        for (Exchange exchange : conversation.exchanges()) {
            messages += exchange.isSettled() ? 2 : 1;
        }
        return new ConversationSummary(conversation.id(), conversation.createdAt(), conversation.title(),
                conversation.status(), messages);
    }
}
