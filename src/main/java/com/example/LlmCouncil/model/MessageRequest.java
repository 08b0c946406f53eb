package com.example.LlmCouncil.model;

/**
 * Request payload for sending a user message into a conversation.
 *
 * @param content user question
 */
public record MessageRequest(String content) {

    public String resolveContent() {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Message content must not be blank");
        }
        return content.trim();
    }
}
