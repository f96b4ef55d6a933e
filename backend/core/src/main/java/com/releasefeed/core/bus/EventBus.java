package com.releasefeed.core.bus;

import com.releasefeed.core.events.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe for pipeline events.
 *
 * <p>A subscription matches every event that is an instance of its type, so subscribing to
 * {@link Event} itself receives everything. Handlers run on the publishing thread in subscription
 * order. A handler that throws is reported to the error callback; the remaining handlers still run.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, error) -> LOGGER.log(Level.WARNING, "Handler for " + event.type() + " failed", error));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscriptions.add(new Subscription<>(type, handler));
    }

    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.class, handler);
    }

    public void publish(Event event) {
        for (Subscription<?> subscription : subscriptions) {
            if (!subscription.matches(event)) {
                continue;
            }
            try {
                subscription.deliver(event);
            } catch (Exception e) {
                onHandlerError.accept(event, e);
            }
        }
    }

    private record Subscription<T extends Event>(Class<T> type, Consumer<T> handler) {
        boolean matches(Event event) {
            return type.isInstance(event);
        }

        void deliver(Event event) {
            handler.accept(type.cast(event));
        }
    }
}
