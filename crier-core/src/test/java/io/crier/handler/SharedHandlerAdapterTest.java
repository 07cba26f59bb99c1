package io.crier.handler;

import io.crier.EventEnvelope;
import io.crier.EventHandler;
import io.crier.TestEvents.OrderPlaced;
import io.crier.TestEvents.Ping;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SharedHandlerAdapterTest {

    @Test
    void invokesHandlerOnExactMatch() throws Exception {
        AtomicInteger seen = new AtomicInteger();
        SharedHandlerAdapter<Ping> adapter = new SharedHandlerAdapter<>(
                EventHandler.of(Ping.class, e -> seen.set(e.seq())));

        assertTrue(adapter.dispatch(EventEnvelope.of(new Ping(7))));
        assertEquals(7, seen.get());
        assertEquals(Ping.class, adapter.eventType());
    }

    @Test
    void skipsOtherTypes() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SharedHandlerAdapter<Ping> adapter = new SharedHandlerAdapter<>(
                EventHandler.of(Ping.class, e -> calls.incrementAndGet()));

        assertFalse(adapter.dispatch(EventEnvelope.of(new OrderPlaced("o-1", 1))));
        assertEquals(0, calls.get());
    }

    @Test
    void propagatesHandlerException() {
        SharedHandlerAdapter<Ping> adapter = new SharedHandlerAdapter<>(
                EventHandler.of(Ping.class, e -> {
                    throw new IllegalStateException("boom");
                }));

        assertThrows(IllegalStateException.class, () -> adapter.dispatch(EventEnvelope.of(new Ping(1))));
    }

    @Test
    void rejectsNullHandler() {
        assertThrows(NullPointerException.class, () -> new SharedHandlerAdapter<Ping>(null));
    }
}
