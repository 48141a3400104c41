package org.abstractica.tabletop.impl.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps authenticated identities to their live session.
 *
 * <p>Thread-safe for concurrent access from connection threads and the
 * scheduler. An identity has at most one registered session; registering a
 * new one hands back the session it replaces.</p>
 */
public class SessionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, DefaultSession> sessionsById = new ConcurrentHashMap<>();
    private final Map<Long, DefaultSession> sessionsByIdentity = new ConcurrentHashMap<>();
    private final int maxSessions;

    /**
     * Creates a registry.
     *
     * @param maxSessions maximum concurrent sessions
     */
    public SessionRegistry(int maxSessions)
    {
        if (maxSessions <= 0)
        {
            throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        }
        this.maxSessions = maxSessions;
    }

    // ========== Session Lookup ==========

    public Optional<DefaultSession> findById(String sessionId)
    {
        Objects.requireNonNull(sessionId, "sessionId");
        return Optional.ofNullable(sessionsById.get(sessionId));
    }

    public Optional<DefaultSession> findByIdentity(long identityId)
    {
        return Optional.ofNullable(sessionsByIdentity.get(identityId));
    }

    /**
     * Finds the session of a user by display name, ignoring case.
     *
     * @param name the user's name
     * @return the session, or empty if that user is not connected
     */
    public Optional<DefaultSession> findByName(String name)
    {
        Objects.requireNonNull(name, "name");
        return sessionsByIdentity.values().stream()
                .filter(s -> s.getIdentity().name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Returns all registered sessions.
     *
     * @return snapshot of the sessions
     */
    public Collection<DefaultSession> getAllSessions()
    {
        return List.copyOf(sessionsById.values());
    }

    public int size()
    {
        return sessionsById.size();
    }

    // ========== Session Registration ==========

    /**
     * Checks whether a login for an identity fits under the session limit.
     * A login that replaces the identity's current session always fits.
     *
     * @param identityId the identity logging in
     * @return true if the session may be created
     */
    public boolean canAccept(long identityId)
    {
        return sessionsByIdentity.containsKey(identityId) || sessionsById.size() < maxSessions;
    }

    /**
     * Registers a session.
     *
     * @param session the new session
     * @return the identity's previous session, which the caller must close
     */
    public Optional<DefaultSession> register(DefaultSession session)
    {
        Objects.requireNonNull(session, "session");
        sessionsById.put(session.getId(), session);
        DefaultSession previous = sessionsByIdentity.put(session.identityId(), session);
        if (previous != null)
        {
            sessionsById.remove(previous.getId(), previous);
            LOG.info("Session {} replaces {} for {}", session.getId(), previous.getId(), session.displayName());
        }
        return Optional.ofNullable(previous);
    }

    /**
     * Removes a session. A newer session of the same identity stays registered.
     *
     * @param session the session
     * @return true if it was registered
     */
    public boolean remove(DefaultSession session)
    {
        Objects.requireNonNull(session, "session");
        sessionsByIdentity.remove(session.identityId(), session);
        return sessionsById.remove(session.getId(), session);
    }
}
