package com.example.LlmCouncil.repository;

import com.example.LlmCouncil.exception.ConversationNotFoundException;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationStatus;
import com.example.LlmCouncil.model.ConversationSummary;
import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.ExchangeFailure;
import com.example.LlmCouncil.model.Stage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis layout:
 * <pre>
 * council:conversations                    ZSET  conversation ids scored by creation time
 * council:conversation:{id}                HASH  id, createdAt, title, status
 * council:conversation:{id}:exchanges      LIST  exchange ids, oldest first
 * council:conversation:{id}:run            STR   run id holding the conversation, with TTL
 * council:exchange:{exchangeId}            HASH  meta, one JSON field per completed stage, failure
 * </pre>
 * A stage checkpoint is a single HSET, so it is either fully written or absent.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "council.store", havingValue = "redis", matchIfMissing = true)
public class RedisExchangeStore implements ExchangeStore {

    private static final Logger log = LoggerFactory.getLogger(RedisExchangeStore.class);

    private static final String INDEX_KEY = "council:conversations";
    private static final String CONVERSATION_PREFIX = "council:conversation:";
    private static final String EXCHANGE_PREFIX = "council:exchange:";

    private static final String META_FIELD = "meta";
    private static final String FAILURE_FIELD = "failure";

    private static final RedisScript<Long> STATUS_CAS = new DefaultRedisScript<>("""
            if redis.call('HGET', KEYS[1], 'status') == ARGV[1] then
              redis.call('HSET', KEYS[1], 'status', ARGV[2])
              return 1
            end
            return 0""", Long.class);

    private static final RedisScript<Long> RELEASE_RUN = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
              return redis.call('DEL', KEYS[1])
            end
            return 0""", Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Conversation createConversation(String conversationId) {
        Instant createdAt = Instant.now();
        redisTemplate.opsForHash().putAll(conversationKey(conversationId), Map.of(
                "id", conversationId,
                "createdAt", createdAt.toString(),
                "title", Conversation.DEFAULT_TITLE,
                "status", ConversationStatus.IDLE.wireName()));
        redisTemplate.opsForZSet().add(INDEX_KEY, conversationId, createdAt.toEpochMilli());
        return new Conversation(conversationId, createdAt, Conversation.DEFAULT_TITLE, ConversationStatus.IDLE, List.of());
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(conversationKey(conversationId));
        if (fields.isEmpty()) {
            return Optional.empty();
        }

        List<String> exchangeIds = redisTemplate.opsForList().range(exchangesKey(conversationId), 0, -1);
        List<Exchange> exchanges = new ArrayList<>();
        if (exchangeIds != null) {
            for (String exchangeId : exchangeIds) {
                readExchange(exchangeId).ifPresent(exchanges::add);
            }
        }

        return Optional.of(new Conversation(
                conversationId,
                Instant.parse(String.valueOf(fields.get("createdAt"))),
                String.valueOf(fields.getOrDefault("title", Conversation.DEFAULT_TITLE)),
                ConversationStatus.fromWireName(String.valueOf(fields.getOrDefault("status", "idle"))),
                List.copyOf(exchanges)));
    }

    @Override
    public List<ConversationSummary> listConversations() {
        Set<String> ids = redisTemplate.opsForZSet().reverseRange(INDEX_KEY, 0, -1);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<ConversationSummary> summaries = new ArrayList<>(ids.size());
        for (String id : ids) {
            findConversation(id).map(ConversationSummary::of).ifPresent(summaries::add);
        }
        return summaries;
    }

    @Override
    public void updateTitle(String conversationId, String title) {
        requireConversation(conversationId);
        redisTemplate.opsForHash().put(conversationKey(conversationId), "title", title);
    }

    @Override
    public void appendExchange(String conversationId, Exchange exchange) {
        requireConversation(conversationId);
        ExchangeMeta meta = new ExchangeMeta(exchange.id(), exchange.question(), exchange.createdAt());
        redisTemplate.opsForHash().put(exchangeKey(exchange.id()), META_FIELD, write(meta));
        for (Stage stage : Stage.values()) {
            if (exchange.isCompleted(stage)) {
                patchExchange(conversationId, exchange.id(), stage, exchange.outputOf(stage));
            }
        }
        redisTemplate.opsForList().rightPush(exchangesKey(conversationId), exchange.id());
    }

    @Override
    public Optional<Exchange> loadExchange(String conversationId) {
        String latestId = redisTemplate.opsForList().index(exchangesKey(conversationId), -1);
        return latestId == null ? Optional.empty() : readExchange(latestId);
    }

    @Override
    public void patchExchange(String conversationId, String exchangeId, Stage stage, Object output) {
        if (output == null || !stage.outputType().isInstance(output)) {
            throw new IllegalArgumentException("Stage " + stage.key() + " expects " + stage.outputType().getSimpleName());
        }
        redisTemplate.opsForHash().put(exchangeKey(exchangeId), stage.key(), write(output));
    }

    @Override
    public void recordFailure(String conversationId, String exchangeId, ExchangeFailure failure) {
        if (failure == null) {
            redisTemplate.opsForHash().delete(exchangeKey(exchangeId), FAILURE_FIELD);
        } else {
            redisTemplate.opsForHash().put(exchangeKey(exchangeId), FAILURE_FIELD, write(failure));
        }
    }

    @Override
    public boolean compareAndSetStatus(String conversationId, ConversationStatus expected, ConversationStatus next) {
        Long swapped = redisTemplate.execute(STATUS_CAS, List.of(conversationKey(conversationId)),
                expected.wireName(), next.wireName());
        return swapped != null && swapped == 1L;
    }

    @Override
    public boolean tryAcquireRun(String conversationId, String runId, Duration lease) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(runKey(conversationId), runId, lease);
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public void releaseRun(String conversationId, String runId) {
        redisTemplate.execute(RELEASE_RUN, List.of(runKey(conversationId)), runId);
    }

    private Optional<Exchange> readExchange(String exchangeId) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(exchangeKey(exchangeId));
        Object rawMeta = fields.get(META_FIELD);
        if (rawMeta == null) {
            return Optional.empty();
        }

        ExchangeMeta meta;
        try {
            meta = objectMapper.readValue(rawMeta.toString(), ExchangeMeta.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping exchange {} with malformed metadata", exchangeId, e);
            return Optional.empty();
        }

        Exchange exchange = Exchange.start(meta.id(), meta.question(), meta.createdAt());
        for (Stage stage : Stage.values()) {
            Object raw = fields.get(stage.key());
            if (raw == null) {
                continue;
            }
            try {
                exchange = exchange.with(stage, objectMapper.readValue(raw.toString(), stage.outputType()));
            } catch (JsonProcessingException e) {
                // Treated as not checkpointed, a resume runs the stage again
                log.warn("Malformed {} checkpoint on exchange {}", stage.key(), exchangeId, e);
            }
        }

        Object rawFailure = fields.get(FAILURE_FIELD);
        if (rawFailure != null) {
            try {
                exchange = exchange.withFailure(objectMapper.readValue(rawFailure.toString(), ExchangeFailure.class));
            } catch (JsonProcessingException e) {
                log.warn("Malformed failure marker on exchange {}", exchangeId, e);
            }
        }
        return Optional.of(exchange);
    }

    private void requireConversation(String conversationId) {
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(conversationKey(conversationId)))) {
            throw new ConversationNotFoundException(conversationId);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String conversationKey(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    private static String exchangesKey(String conversationId) {
        return CONVERSATION_PREFIX + conversationId + ":exchanges";
    }

    private static String runKey(String conversationId) {
        return CONVERSATION_PREFIX + conversationId + ":run";
    }

    private static String exchangeKey(String exchangeId) {
        return EXCHANGE_PREFIX + exchangeId;
    }

    record ExchangeMeta(String id, String question, Instant createdAt) {
    }
}
