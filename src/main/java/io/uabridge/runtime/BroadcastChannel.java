package io.uabridge.runtime;

import io.uabridge.model.WatchSnapshot;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded single-generation source of watch broadcasts. Producers never block: a full or closed
 * channel drops the message. The controller closes the channel on disconnect and installs a new
 * one; consumers re-read the controller's current channel once they observe the closure.
 */
public final class BroadcastChannel {
    public static final int DEFAULT_CAPACITY = 64;

    private final BlockingQueue<WatchSnapshot> queue;
    private volatile boolean closed;

    public BroadcastChannel() {
        this(DEFAULT_CAPACITY);
    }

    public BroadcastChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public boolean offer(WatchSnapshot message) {
        if (closed) {
            return false;
        }
        return queue.offer(message);
    }

    public WatchSnapshot poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    // Closing discards whatever is still queued.
    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
