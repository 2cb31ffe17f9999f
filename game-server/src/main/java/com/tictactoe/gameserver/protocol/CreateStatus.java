package com.tictactoe.gameserver.protocol;

public enum CreateStatus implements AckStatus {
    OK(0),
    INVALID_NAME(1),
    DUPLICATE_NAME(2),
    DIRECTORY_FULL(3),
    MALFORMED(4),
    ALREADY_SEATED(5);

    private final int code;

    CreateStatus(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
