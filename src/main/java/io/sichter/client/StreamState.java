package io.sichter.client;

import io.sichter.model.Event;

import java.util.List;

public record StreamState(boolean connected, List<Event> events, String error) {
    public StreamState {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
