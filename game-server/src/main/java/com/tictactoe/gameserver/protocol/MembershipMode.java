package com.tictactoe.gameserver.protocol;

import java.util.Locale;
import java.util.Optional;

public enum MembershipMode {
    PLAYER,
    VIEWER;

    public static Optional<MembershipMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "PLAYER" -> Optional.of(PLAYER);
            case "VIEWER" -> Optional.of(VIEWER);
            default -> Optional.empty();
        };
    }
}
