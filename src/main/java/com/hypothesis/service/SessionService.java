package com.hypothesis.service;

import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sessions for the lifetime of the process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private final ResearchProperties properties;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Existing session, or a new one under the given id (a random id when null or blank).
     */
    public Session getOrCreate(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId.trim();
        return sessions.computeIfAbsent(id, key -> {
            log.info("Created session {}", key);
            return new Session(key, properties.getHistoryWindow());
        });
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean remove(String sessionId) {
        Session removed = sessions.remove(sessionId);
        if (removed != null) {
            removed.abandonActiveTurn();
            log.info("Removed session {}", sessionId);
        }
        return removed != null;
    }

    public int count() {
        return sessions.size();
    }
}
