package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.ConversationNotFoundException;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationSummary;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.repository.ExchangeStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ConversationService {

    static final String NO_HISTORY = "(no prior conversation)";

    private final ExchangeStore exchangeStore;
    private final CouncilProperties properties;

    public Conversation create() {
        return exchangeStore.createConversation(UUID.randomUUID().toString());
    }

    public List<ConversationSummary> list() {
        return exchangeStore.listConversations();
    }

    public Conversation get(String conversationId) {
        return exchangeStore.findConversation(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    /**
     * Render the conversation before {@code exchangeId} for the bidders:
     *  - Only settled exchanges contribute, as a user and an assistant message
     *  - Take the latest {@code council.pipeline.history-messages} messages
     *  - Join them as "role: content" lines
     */
    public String renderHistory(Conversation conversation, String exchangeId) {
        List<String> messages = new ArrayList<>();
        for (Exchange exchange : conversation.exchanges()) {
            if (exchange.id().equals(exchangeId)) {
                break;
            }
            if (exchange.isSettled() && exchange.evaluation() != null) {
                messages.add("user: " + exchange.question());
                messages.add("assistant: " + exchange.evaluation().aggregatedAnswer());
            }
        }
        if (messages.isEmpty()) {
            return NO_HISTORY;
        }

        int size = messages.size();
        int startIdx = Math.max(0, size - properties.pipeline().historyMessages());
        return messages.subList(startIdx, size).stream().collect(Collectors.joining("\n"));
    }
}
