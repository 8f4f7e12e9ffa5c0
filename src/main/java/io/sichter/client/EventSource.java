package io.sichter.client;

import io.sichter.model.Event;

import java.util.List;

public interface EventSource {

    Handle start(Listener listener);

    interface Listener {
        default void onOpen() {
        }

        default void onEvent(Event event) {
        }

        default void onSnapshot(List<Event> events) {
        }

        void onError(Exception error);
    }

    interface Handle extends AutoCloseable {
        @Override
        void close();
    }
}
