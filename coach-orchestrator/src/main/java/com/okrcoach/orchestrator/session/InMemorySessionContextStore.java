package com.okrcoach.orchestrator.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.okrcoach.orchestrator.exception.CoachingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store keeping one JSON snapshot per session id.
 *
 * <p>Snapshots are serialized on save and parsed on load, so callers never share
 * instances with the store. Thread-safe via {@link ConcurrentHashMap}.
 */
public class InMemorySessionContextStore implements SessionContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionContextStore.class);
    private static final String COMPONENT = "InMemorySessionContextStore";

    private final ConcurrentHashMap<String, String> snapshots = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemorySessionContextStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SessionContext> load(String sessionId) {
        String json = snapshots.get(sessionId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SessionContext.class));
        } catch (JsonProcessingException e) {
            throw new CoachingException(COMPONENT, "Snapshot unreadable. sessionId=" + sessionId, e);
        }
    }

    @Override
    public void save(SessionContext context) {
        try {
            snapshots.put(context.sessionId(), objectMapper.writeValueAsString(context));
            log.debug("[InMemorySessionContextStore] Saved. sessionId={} turn={}", context.sessionId(), context.turnCount());
        } catch (JsonProcessingException e) {
            throw new CoachingException(COMPONENT, "Snapshot not serializable. sessionId=" + context.sessionId(), e);
        }
    }
}
