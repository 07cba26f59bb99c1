package io.crier.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for a publisher's worker pool.
 *
 * <p>Threads are daemon threads named {@code <prefix>1}, {@code <prefix>2}, etc. Each factory
 * also remembers which threads it created, so a publish issued from inside one of its own
 * workers can be detected with {@link #isWorkerThread()}.
 */
public final class PublisherThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);
    private final ThreadLocal<Boolean> worker = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public PublisherThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        Thread thread = new Thread(() -> {
            worker.set(Boolean.TRUE);
            runnable.run();
        }, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }

    /**
     * Whether the calling thread was created by this factory.
     */
    public boolean isWorkerThread() {
        return worker.get();
    }
}
