package com.tictactoe.gameserver.protocol;

public enum PlaceStatus implements AckStatus {
    MALFORMED(1);

    private final int code;

    PlaceStatus(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
