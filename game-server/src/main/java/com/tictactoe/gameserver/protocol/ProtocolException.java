package com.tictactoe.gameserver.protocol;

/**
 * Raised when a server frame cannot be parsed back into a {@link ServerEvent}.
 */
public class ProtocolException extends IllegalArgumentException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
