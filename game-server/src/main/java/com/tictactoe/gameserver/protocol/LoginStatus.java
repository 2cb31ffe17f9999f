package com.tictactoe.gameserver.protocol;

public enum LoginStatus implements AckStatus {
    OK(0),
    NO_SUCH_USER(1),
    WRONG_PASSWORD(2),
    MALFORMED(3);

    private final int code;

    LoginStatus(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
