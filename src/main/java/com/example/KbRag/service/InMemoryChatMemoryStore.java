package com.example.KbRag.service;

import com.example.KbRag.config.ChatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local history store, the default.
 *
 * There is no background sweeper: sessions idle longer than their TTL are dropped
 * on the next write to any session.
 */
@Service
@ConditionalOnProperty(prefix = "rag.chat", name = "memory-store", havingValue = "memory", matchIfMissing = true)
public class InMemoryChatMemoryStore implements ChatMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChatMemoryStore.class);

    private static final Duration TEMPORARY_TTL = Duration.ofMinutes(1);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final ChatProperties properties;
    private final Clock clock;

    public InMemoryChatMemoryStore(ChatProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<StoredMessage> loadHistory(String sessionId, String model) {
        Session session = sessions.get(sessionId);
        Instant now = clock.instant();
        if (session == null || session.isExpired(now) || !Objects.equals(session.model(), model)) {
            return List.of();
        }
        return session.messages();
    }

    @Override
    public void appendTurn(String sessionId, String model, String userMessage, String assistantMessage, boolean temporary) {
        Instant now = clock.instant();
        purgeExpired(now);

        long ts = now.toEpochMilli();
        List<StoredMessage> turn = List.of(
                new StoredMessage("user", userMessage, ts),
                new StoredMessage("assistant", assistantMessage, ts)
        );
        Duration ttl = temporary ? TEMPORARY_TTL : properties.getSessionTtl();

        sessions.compute(sessionId, (id, existing) -> {
            List<StoredMessage> messages = new ArrayList<>();
            if (existing != null && !existing.isExpired(now)) {
                if (Objects.equals(existing.model(), model)) {
                    messages.addAll(existing.messages());
                } else {
                    log.info("Session {} switched model {} -> {}, history cleared", id, existing.model(), model);
                }
            }
            messages.addAll(turn);
            int max = properties.getMaxMessages();
            if (messages.size() > max) {
                messages = messages.subList(messages.size() - max, messages.size());
            }
            return new Session(model, List.copyOf(messages), now, ttl);
        });
    }

    @Override
    public void clear(String sessionId) {
        sessions.remove(sessionId);
    }

    int sessionCount() {
        return sessions.size();
    }

    private void purgeExpired(Instant now) {
        int before = sessions.size();
        sessions.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.debug("Dropped {} expired chat session(s)", removed);
        }
    }

    private record Session(String model, List<StoredMessage> messages, Instant lastWrite, Duration ttl) {
        boolean isExpired(Instant now) {
            return lastWrite.plus(ttl).isBefore(now);
        }
    }
}
