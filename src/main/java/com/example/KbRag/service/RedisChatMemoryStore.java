package com.example.KbRag.service;

import com.example.KbRag.config.ChatProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed history store, enabled with {@code rag.chat.memory-store=redis}.
 *
 * Each session is a Redis list of JSON messages plus a string key holding the model.
 * Both keys share a rolling TTL refreshed on every turn.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rag.chat", name = "memory-store", havingValue = "redis")
public class RedisChatMemoryStore implements ChatMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(RedisChatMemoryStore.class);

    private static final String KEY_PREFIX = "chat:memory:";
    private static final String MODEL_KEY_PREFIX = "chat:model:";

    private static final Duration TEMPORARY_TTL = Duration.ofMinutes(1);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ChatProperties properties;

    /**
     * Load only the latest maxMessages entries to avoid reading an overly long list.
     */
    @Override
    public List<StoredMessage> loadHistory(String sessionId, String model) {
        String storedModel = redisTemplate.opsForValue().get(modelKey(sessionId));
        if (storedModel != null && !storedModel.equals(model)) {
            return List.of();
        }

        String key = messagesKey(sessionId);
        Long size = redisTemplate.opsForList().size(key);
        if (size == null || size == 0L) {
            return List.of();
        }

        long start = Math.max(0, size - properties.getMaxMessages());
        List<String> rawMessages = redisTemplate.opsForList().range(key, start, size - 1);
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<StoredMessage> messages = new ArrayList<>();
        for (String raw : rawMessages) {
            try {
                messages.add(objectMapper.readValue(raw, StoredMessage.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed history entry in session {}: {}", sessionId, e.getOriginalMessage());
            }
        }
        return messages;
    }

    @Override
    public void appendTurn(String sessionId, String model, String userMessage, String assistantMessage, boolean temporary) {
        String key = messagesKey(sessionId);
        String modelKey = modelKey(sessionId);

        String storedModel = redisTemplate.opsForValue().get(modelKey);
        if (storedModel != null && !storedModel.equals(model)) {
            log.info("Session {} switched model {} -> {}, history cleared", sessionId, storedModel, model);
            redisTemplate.delete(key);
        }

        long now = Instant.now().toEpochMilli();
        List<StoredMessage> turn = List.of(
                new StoredMessage("user", userMessage, now),
                new StoredMessage("assistant", assistantMessage, now)
        );
        for (StoredMessage message : turn) {
            try {
                redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(message));
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize {} message for session {}: {}", message.role(), sessionId, e.getOriginalMessage());
            }
        }

        int max = properties.getMaxMessages();
        Long size = redisTemplate.opsForList().size(key);
        if (size != null && size > max) {
            redisTemplate.opsForList().trim(key, size - max, size - 1);
        }

        Duration ttl = temporary ? TEMPORARY_TTL : properties.getSessionTtl();
        redisTemplate.opsForValue().set(modelKey, model, ttl);
        redisTemplate.expire(key, ttl);
    }

    @Override
    public void clear(String sessionId) {
        redisTemplate.delete(List.of(messagesKey(sessionId), modelKey(sessionId)));
    }

    private static String messagesKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    private static String modelKey(String sessionId) {
        return MODEL_KEY_PREFIX + sessionId;
    }
}
