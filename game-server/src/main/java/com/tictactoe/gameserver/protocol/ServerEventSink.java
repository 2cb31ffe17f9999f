package com.tictactoe.gameserver.protocol;

/**
 * Delivers an event to one connection. Delivery to a connection that is
 * already gone is silently dropped.
 */
@FunctionalInterface
public interface ServerEventSink {
    void send(long connectionId, ServerEvent event);
}
