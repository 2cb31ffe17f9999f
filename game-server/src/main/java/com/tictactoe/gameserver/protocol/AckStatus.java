package com.tictactoe.gameserver.protocol;

/**
 * Numeric status carried in an {@code <COMMAND>:ACKSTATUS:<code>} frame.
 */
public interface AckStatus {
    int code();

    static <E extends Enum<E> & AckStatus> E fromCode(Class<E> type, int code) {
        for (E status : type.getEnumConstants()) {
            if (status.code() == code) {
                return status;
            }
        }
        throw new ProtocolException("Unknown " + type.getSimpleName() + " code " + code);
    }
}
