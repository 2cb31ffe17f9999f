package com.tictactoe.gameserver.protocol;

public enum JoinStatus implements AckStatus {
    OK(0),
    NO_SUCH_ROOM(1),
    ROOM_FULL(2),
    INVALID_MODE(3),
    ALREADY_JOINED(4);

    private final int code;

    JoinStatus(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
