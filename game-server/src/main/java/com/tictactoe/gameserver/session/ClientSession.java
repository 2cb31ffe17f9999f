package com.tictactoe.gameserver.session;

import java.util.Optional;

/**
 * Authentication state of one live connection.
 */
public class ClientSession {
    private final long connectionId;
    private final String remoteAddress;
    private String username;

    ClientSession(long connectionId, String remoteAddress) {
        this.connectionId = connectionId;
        this.remoteAddress = remoteAddress;
    }

    public long connectionId() {
        return connectionId;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public Optional<String> username() {
        return Optional.ofNullable(username);
    }

    public boolean isAuthed() {
        return username != null;
    }

    void authenticate(String username) {
        this.username = username;
    }
}
