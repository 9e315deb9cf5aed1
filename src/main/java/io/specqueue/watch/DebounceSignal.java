package io.specqueue.watch;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Per-source wake-up signal that collapses bursts of file events.
 *
 * <p>{@link #notify(String)} accepts an event for a path only when no event for that
 * path was accepted within the debounce window; accepting restarts the window.
 * Workers block in {@link #await(Duration)} until {@link #signal()} is called.
 */
public final class DebounceSignal {
    public static final Duration DEFAULT_WINDOW = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(60);

    private final long windowMs;
    private final LongSupplier clockMs;
    private final Map<String, Long> acceptedAt = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition woken = lock.newCondition();
    private boolean signaled;

    public DebounceSignal(Duration window) {
        this(window, System::currentTimeMillis);
    }

    public DebounceSignal(Duration window, LongSupplier clockMs) {
        this.windowMs = window == null || window.isNegative() ? DEFAULT_WINDOW.toMillis() : window.toMillis();
        this.clockMs = clockMs;
    }

    public boolean notify(String path) {
        long now = clockMs.getAsLong();
        lock.lock();
        try {
            Long last = acceptedAt.get(path);
            if (last != null && now - last < windowMs) {
                return false;
            }
            acceptedAt.put(path, now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int cleanup(Duration maxAge) {
        long cutoff = clockMs.getAsLong() - maxAge.toMillis();
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, Long>> it = acceptedAt.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue() <= cutoff) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    public int trackedPaths() {
        lock.lock();
        try {
            return acceptedAt.size();
        } finally {
            lock.unlock();
        }
    }

    public void signal() {
        lock.lock();
        try {
            signaled = true;
            woken.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean await(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (!signaled) {
                if (remainingNanos <= 0L) {
                    return false;
                }
                remainingNanos = woken.awaitNanos(remainingNanos);
            }
            signaled = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            signaled = false;
        } finally {
            lock.unlock();
        }
    }
}
