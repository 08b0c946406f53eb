package com.example.LlmCouncil.repository;

import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationStatus;
import com.example.LlmCouncil.model.ConversationSummary;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.ExchangeFailure;
import com.example.LlmCouncil.model.Stage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of conversations and their exchanges.
 * <p>
 * Every stage output is written with a single {@link #patchExchange} call, which must be atomic:
 * a reader sees either the whole stage output or none of it. The stage fields that are present
 * form the checkpoint a resumed run continues from.
 */
public interface ExchangeStore {

    /**
     * Create an idle conversation with the default title.
     */
    Conversation createConversation(String conversationId);

    Optional<Conversation> findConversation(String conversationId);

    /**
     * Summaries, newest first.
     */
    List<ConversationSummary> listConversations();

    void updateTitle(String conversationId, String title);

    /**
     * Append a freshly started exchange; it becomes the conversation's latest exchange.
     */
    void appendExchange(String conversationId, Exchange exchange);

    /**
     * Latest exchange of the conversation with every persisted stage output applied.
     */
    Optional<Exchange> loadExchange(String conversationId);

    /**
     * Persist one stage output of an exchange.
     */
    void patchExchange(String conversationId, String exchangeId, Stage stage, Object output);

    /**
     * Set or, with {@code null}, clear the failure marker of an exchange.
     */
    void recordFailure(String conversationId, String exchangeId, ExchangeFailure failure);

    /**
     * Atomically move the conversation status from {@code expected} to {@code next}.
     *
     * @return false when the conversation is unknown or its status was not {@code expected}
     */
    boolean compareAndSetStatus(String conversationId, ConversationStatus expected, ConversationStatus next);

    /**
     * Claim the conversation for one pipeline run. The claim expires after {@code lease}
     * so a crashed run does not block resumes forever.
     */
    boolean tryAcquireRun(String conversationId, String runId, Duration lease);

    /**
     * Release the claim if {@code runId} still holds it.
     */
    void releaseRun(String conversationId, String runId);
}
