package io.crier.handler;

import io.crier.EventEnvelope;
import io.crier.MutatingEventHandler;
import io.crier.TestEvents.Ping;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeldHandlersTest {
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void nothingIsHeldOutsideADispatch() {
        ExclusiveHandlerAdapter<Ping> adapter = new ExclusiveHandlerAdapter<>(new MutatingEventHandler<Ping>() {
            @Override
            public void handle(Ping event) {
            }
        });
        assertFalse(HeldHandlers.isHeld(adapter));
    }

    @Test
    void taskSubmittedWhileHoldingAnAdapterCannotEnterIt() throws Exception {
        AtomicReference<ExclusiveHandlerAdapter<Ping>> self = new AtomicReference<>();
        AtomicReference<Throwable> nested = new AtomicReference<>();
        MutatingEventHandler<Ping> relay = new MutatingEventHandler<Ping>() {
            @Override
            public void handle(Ping event) throws Exception {
                if (event.seq() > 0) {
                    return;
                }
                Future<Boolean> task = executor.submit(HeldHandlers.propagate(
                        () -> self.get().dispatch(EventEnvelope.of(new Ping(1)))));
                ExecutionException e = assertThrows(ExecutionException.class,
                        () -> task.get(5, TimeUnit.SECONDS));
                nested.set(e.getCause());
            }
        };
        ExclusiveHandlerAdapter<Ping> adapter = new ExclusiveHandlerAdapter<>(relay);
        self.set(adapter);

        assertTrue(adapter.dispatch(EventEnvelope.of(new Ping(0))));

        assertNotNull(nested.get());
        assertInstanceOf(IllegalStateException.class, nested.get());
        assertFalse(adapter.isPoisoned());
        assertFalse(HeldHandlers.isHeld(adapter));
    }

    @Test
    void workerStateIsRestoredAfterPropagatedTask() throws Exception {
        ExclusiveHandlerAdapter<Ping> adapter = new ExclusiveHandlerAdapter<>(new MutatingEventHandler<Ping>() {
            @Override
            public void handle(Ping event) throws Exception {
                executor.submit(HeldHandlers.propagate(() -> Boolean.TRUE)).get(5, TimeUnit.SECONDS);
            }
        });

        adapter.dispatch(EventEnvelope.of(new Ping(0)));

        Future<Boolean> later = executor.submit(() -> HeldHandlers.isHeld(adapter));
        assertFalse(later.get(5, TimeUnit.SECONDS));
    }
}
