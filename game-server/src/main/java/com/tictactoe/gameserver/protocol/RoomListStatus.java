package com.tictactoe.gameserver.protocol;

public enum RoomListStatus implements AckStatus {
    OK(0),
    INVALID_MODE(1);

    private final int code;

    RoomListStatus(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
