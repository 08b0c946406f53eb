package com.example.LlmCouncil.model;

import java.time.Instant;

/**
 * Marker left on an exchange whose run stopped on a fatal error.
 * Resuming retries {@code stage} and clears the marker.
 */
public record ExchangeFailure(
        String stage,
        String message,
        Instant failedAt
) {
}
