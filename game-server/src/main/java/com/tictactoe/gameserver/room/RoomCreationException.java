package com.tictactoe.gameserver.room;

public class RoomCreationException extends RuntimeException {
    private final Reason reason;

    public RoomCreationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        INVALID_NAME,
        DUPLICATE_NAME,
        DIRECTORY_FULL
    }
}
