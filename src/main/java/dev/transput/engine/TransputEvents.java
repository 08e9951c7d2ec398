package dev.transput.engine;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public final class TransputEvents {
    private final Map<TransputEvent, EventHandler> handlers = new EnumMap<>(TransputEvent.class);

    public TransputEvents on(TransputEvent event, EventHandler handler) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");
        handlers.put(event, handler);
        return this;
    }

    public void remove(TransputEvent event) {
        Objects.requireNonNull(event, "event");
        handlers.remove(event);
    }

    /** The registered handler, or {@code null}. */
    public EventHandler resolve(TransputEvent event) {
        Objects.requireNonNull(event, "event");
        return handlers.get(event);
    }
}
