package com.linlay.sessionrelay.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions with a request in flight, keyed by session id (or a pending key until a fresh session reports its id).
 * Absence from the registry is the normal idle state, never an error.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final String PENDING_PREFIX = "pending-";

    private final Map<String, ActiveSession> sessionsByKey = new ConcurrentHashMap<>();

    public static boolean isPendingKey(String key) {
        return key != null && key.startsWith(PENDING_PREFIX);
    }

    public static String pendingKey(String suffix) {
        return PENDING_PREFIX + suffix;
    }

    public void register(String key, ActiveSession session) {
        ActiveSession previous = sessionsByKey.put(requireKey(key), session);
        if (previous != null && previous != session) {
            log.warn("Session {} already had an active request, replacing it", key);
        }
    }

    /**
     * Moves an entry from its pending key to the session id the agent assigned. A cancelled session only loses
     * its pending key.
     */
    public void rebind(String fromKey, String sessionId, ActiveSession session) {
        String target = requireKey(sessionId);
        sessionsByKey.remove(requireKey(fromKey), session);
        if (session.isCancelled()) {
            return;
        }
        register(target, session);
    }

    public Optional<ActiveSession> find(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionsByKey.get(sessionId.trim()));
    }

    public boolean isBusy(String sessionId) {
        return find(sessionId).isPresent();
    }

    /**
     * Removes the session and signals its process. False means there was nothing to cancel.
     */
    public boolean cancel(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        ActiveSession session = sessionsByKey.remove(sessionId.trim());
        if (session == null) {
            return false;
        }
        session.cancel();
        log.info("Cancelled session {} pid={}", sessionId, session.process().pid());
        return true;
    }

    /**
     * Removes the entry only if the key still maps to this session, so a finished request never unregisters a newer
     * one for the same id.
     */
    public boolean unregister(String key, ActiveSession session) {
        if (!StringUtils.hasText(key) || session == null) {
            return false;
        }
        return sessionsByKey.remove(key.trim(), session);
    }

    public List<String> activeSessionIds() {
        return sessionsByKey.keySet().stream()
                .filter(key -> !isPendingKey(key))
                .sorted()
                .toList();
    }

    private String requireKey(String key) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("session key is required");
        }
        return key.trim();
    }
}
