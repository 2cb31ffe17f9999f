package com.tictactoe.gameserver.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every event sent, in order, as encoded frames.
 */
public class RecordingSink implements ServerEventSink {
    public record Delivery(long connectionId, String frame) {}

    private final List<Delivery> deliveries = new ArrayList<>();

    @Override
    public void send(long connectionId, ServerEvent event) {
        deliveries.add(new Delivery(connectionId, event.frame()));
    }

    public List<String> framesFor(long connectionId) {
        return deliveries.stream()
                .filter(d -> d.connectionId() == connectionId)
                .map(Delivery::frame)
                .toList();
    }

    public String lastFrameFor(long connectionId) {
        List<String> frames = framesFor(connectionId);
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public void clear() {
        deliveries.clear();
    }
}
