package com.tictactoe.gameserver.room;

public enum Marker {
    EMPTY('0'),
    FIRST('1'),
    SECOND('2');

    private final char symbol;

    Marker(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /** Marker of the player seated at {@code seatIndex} (0 or 1). */
    public static Marker forSeat(int seatIndex) {
        return switch (seatIndex) {
            case 0 -> FIRST;
            case 1 -> SECOND;
            default -> throw new IllegalArgumentException("No marker for seat " + seatIndex);
        };
    }
}
