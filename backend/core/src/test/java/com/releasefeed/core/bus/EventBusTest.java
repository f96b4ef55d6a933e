package com.releasefeed.core.bus;

import com.releasefeed.core.events.Event;
import com.releasefeed.core.events.FeedValidated;
import com.releasefeed.core.events.StageStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(StageStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(StageStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new StageStarted(Instant.parse("2026-01-01T00:00:00Z"), "discovery", 5));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger stageHits = new AtomicInteger();
        AtomicInteger validationHits = new AtomicInteger();

        bus.subscribe(StageStarted.class, event -> stageHits.incrementAndGet());
        bus.subscribe(FeedValidated.class, event -> validationHits.incrementAndGet());

        bus.publish(new StageStarted(Instant.parse("2026-01-01T00:00:00Z"), "validation", 3));
        bus.publish(new FeedValidated(Instant.parse("2026-01-01T00:00:01Z"), "https://example.com/feed", 200, true, 12));

        assertEquals(1, stageHits.get());
        assertEquals(1, validationHits.get());
    }

    @Test
    void catchAllSubscribersSeeEveryEvent() {
        EventBus bus = new EventBus();
        List<Event> seen = new CopyOnWriteArrayList<>();
        bus.subscribeAll(seen::add);

        bus.publish(new StageStarted(Instant.parse("2026-01-01T00:00:00Z"), "parsing", 1));
        bus.publish(new FeedValidated(Instant.parse("2026-01-01T00:00:01Z"), "https://example.com/feed", 404, false, 3));

        assertEquals(2, seen.size());
        assertEquals("StageStarted", seen.get(0).type());
        assertEquals("FeedValidated", seen.get(1).type());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(StageStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(StageStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new StageStarted(Instant.parse("2026-01-01T00:00:00Z"), "aggregation", 0));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void subscriptionToEventInterfaceReceivesEveryType() {
        EventBus bus = new EventBus();
        List<String> types = new CopyOnWriteArrayList<>();
        bus.subscribe(Event.class, event -> types.add(event.type()));

        bus.publish(new StageStarted(Instant.parse("2026-01-01T00:00:00Z"), "discovery", 2));
        bus.publish(new FeedValidated(Instant.parse("2026-01-01T00:00:01Z"), "https://example.com/feed", 200, true, 4));

        assertEquals(List.of("StageStarted", "FeedValidated"), types);
    }
}
