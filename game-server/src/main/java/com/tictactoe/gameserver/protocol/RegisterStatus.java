package com.tictactoe.gameserver.protocol;

public enum RegisterStatus implements AckStatus {
    OK(0),
    DUPLICATE_USER(1),
    MALFORMED(2),
    PASSWORD_TOO_SHORT(3),
    NOT_ALPHANUMERIC(4);

    private final int code;

    RegisterStatus(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
