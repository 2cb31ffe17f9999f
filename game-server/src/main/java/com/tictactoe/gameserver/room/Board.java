package com.tictactoe.gameserver.room;

import java.util.Arrays;

/**
 * 3x3 grid addressed by zero-based column and row; cell index is {@code row * 3 + column}.
 */
public class Board {
    public static final int SIZE = 3;
    public static final int CELLS = SIZE * SIZE;

    private static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},
            {0, 4, 8}, {2, 4, 6}
    };

    private final Marker[] cells = new Marker[CELLS];

    public Board() {
        Arrays.fill(cells, Marker.EMPTY);
    }

    public static boolean inRange(int column, int row) {
        return column >= 0 && column < SIZE && row >= 0 && row < SIZE;
    }

    public static int indexOf(int column, int row) {
        if (!inRange(column, row)) {
            throw new IllegalArgumentException("Cell out of range: column=" + column + ", row=" + row);
        }
        return row * SIZE + column;
    }

    void place(int column, int row, Marker marker) {
        if (marker == Marker.EMPTY) {
            throw new IllegalArgumentException("Cannot place an empty marker");
        }
        cells[indexOf(column, row)] = marker;
    }

    public boolean hasLine(Marker marker) {
        for (int[] line : LINES) {
            if (cells[line[0]] == marker && cells[line[1]] == marker && cells[line[2]] == marker) {
                return true;
            }
        }
        return false;
    }

    public boolean isFull() {
        for (Marker cell : cells) {
            if (cell == Marker.EMPTY) {
                return false;
            }
        }
        return true;
    }

    /** Nine characters, one per cell in index order: '0' empty, '1' first player, '2' second. */
    public String encode() {
        StringBuilder builder = new StringBuilder(CELLS);
        for (Marker cell : cells) {
            builder.append(cell.symbol());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return encode();
    }
}
