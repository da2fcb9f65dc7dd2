package hookrelay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for the relay's background loops (listener, delivery worker,
 * retry scheduler).
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. and are daemon
 * threads, so an application that forgets to close its relay can still exit.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
