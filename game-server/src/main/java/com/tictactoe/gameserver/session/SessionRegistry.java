package com.tictactoe.gameserver.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Connection id to {@link ClientSession}. Holds no game state.
 * <p>
 * Not synchronized: mutated only by the event loop thread.
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Long, ClientSession> sessions = new HashMap<>();

    public ClientSession register(long connectionId) {
        return register(connectionId, null);
    }

    public ClientSession register(long connectionId, String remoteAddress) {
        ClientSession session = new ClientSession(connectionId, remoteAddress);
        ClientSession previous = sessions.putIfAbsent(connectionId, session);
        if (previous != null) {
            throw new IllegalStateException("Connection " + connectionId + " is already registered");
        }
        return session;
    }

    public void authenticate(long connectionId, String username) {
        ClientSession session = require(connectionId);
        session.authenticate(username);
        log.info("LOGIN {} on connection {} from {}", username, connectionId, session.remoteAddress());
    }

    public boolean isAuthenticated(long connectionId) {
        ClientSession session = sessions.get(connectionId);
        return session != null && session.isAuthed();
    }

    public Optional<String> usernameOf(long connectionId) {
        ClientSession session = sessions.get(connectionId);
        return session == null ? Optional.empty() : session.username();
    }

    public Optional<ClientSession> find(long connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public void remove(long connectionId) {
        sessions.remove(connectionId);
    }

    public int size() {
        return sessions.size();
    }

    private ClientSession require(long connectionId) {
        ClientSession session = sessions.get(connectionId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown connection " + connectionId);
        }
        return session;
    }
}
