package com.blissfly.proxy.core.session;

import java.io.IOException;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of live shared sessions.
 * <p>
 * A session exists while it has at least one member; removing the last member deletes
 * it. All mutations happen under the instance monitor. Messages are delivered after the
 * monitor is released, so a slow member never blocks the registry.
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, Session> sessions = new HashMap<>();
    private final Clock clock;

    public SessionManager() {
        this(Clock.systemUTC());
    }

    public SessionManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Adds a member to a session, creating the session if needed.
     *
     * @param sessionId Requested id; a new one is generated when null or blank.
     * @param type      Session type used when the session is created.
     * @param settings  Settings used when the session is created.
     * @param member    The joining member.
     * @return View of the joined session.
     */
    public synchronized SessionView join(String sessionId, String type, Map<String, Object> settings,
            SessionMember member) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        long now = clock.millis();
        Session session = sessions.computeIfAbsent(id, k -> {
            log.debug("Creating session {} of type {}", k, type);
            return new Session(k, type == null ? "default" : type, settings, now);
        });
        session.addMember(member, now);
        return session.view();
    }

    /**
     * Merges partial state into a session.
     *
     * @param sessionId Session to update.
     * @param partial   Keys to set; null values remove keys.
     * @return The merged view, or empty if the session does not exist.
     */
    public synchronized Optional<SessionView> mergeState(String sessionId, Map<String, Object> partial) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        session.mergeState(partial, clock.millis());
        return Optional.of(session.view());
    }

    /**
     * Removes a member; deletes the session when it becomes empty.
     *
     * @param sessionId Session the member belongs to.
     * @param member    The leaving member.
     * @return View of the remaining session, or empty if it was deleted or unknown.
     */
    public synchronized Optional<SessionView> leave(String sessionId, SessionMember member) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        session.removeMember(member, clock.millis());
        if (session.isEmpty()) {
            sessions.remove(sessionId);
            log.debug("Session {} closed", sessionId);
            return Optional.empty();
        }
        return Optional.of(session.view());
    }

    /**
     * @param sessionId Session id.
     * @return Current view of the session, if it exists.
     */
    public synchronized Optional<SessionView> find(String sessionId) {
        Session session = sessions.get(sessionId);
        return session == null ? Optional.empty() : Optional.of(session.view());
    }

    /**
     * @return Number of live sessions.
     */
    public synchronized int sessionCount() {
        return sessions.size();
    }

    /**
     * Sends a message to every member of a session.
     *
     * @param sessionId Target session.
     * @param message   Serialized JSON.
     * @param except    Member to skip, may be null.
     */
    public void broadcast(String sessionId, String message, SessionMember except) {
        List<SessionMember> recipients;
        synchronized (this) {
            Session session = sessions.get(sessionId);
            if (session == null) {
                return;
            }
            recipients = session.members();
        }
        for (SessionMember member : recipients) {
            if (except != null && member.id().equals(except.id())) {
                continue;
            }
            try {
                member.send(message);
            } catch (IOException e) {
                log.debug("Failed to deliver session message to {}: {}", member.id(), e.getMessage());
            }
        }
    }
}
