package com.tictactoe.gameserver.protocol;

/**
 * How a match ended, as carried in the {@code GAMEEND} frame.
 */
public enum GameEndKind {
    WIN(0, true),
    DRAW(1, false),
    FORFEIT(2, true);

    private final int code;
    private final boolean hasWinner;

    GameEndKind(int code, boolean hasWinner) {
        this.code = code;
        this.hasWinner = hasWinner;
    }

    public int code() {
        return code;
    }

    public boolean hasWinner() {
        return hasWinner;
    }

    public static GameEndKind fromCode(int code) {
        for (GameEndKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new ProtocolException("Unknown game end code " + code);
    }
}
