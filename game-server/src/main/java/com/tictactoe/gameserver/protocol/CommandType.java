package com.tictactoe.gameserver.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of client command keywords. Keywords are matched case-sensitively.
 */
public enum CommandType {
    LOGIN(false),
    REGISTER(false),
    ROOMLIST(true),
    CREATE(true),
    JOIN(true),
    PLACE(true),
    FORFEIT(true);

    private final boolean requiresAuth;

    CommandType(boolean requiresAuth) {
        this.requiresAuth = requiresAuth;
    }

    public boolean requiresAuth() {
        return requiresAuth;
    }

    public static Optional<CommandType> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(keyword))
                .findFirst();
    }
}
