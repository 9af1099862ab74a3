package io.uabridge.hub;

import io.uabridge.model.WatchSnapshot;
import io.uabridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One hub subscriber: a bounded outbound queue drained by a dedicated writer thread, plus the
 * node filter the client asked for.
 */
public final class HubClient {
    private static final Logger log = LoggerFactory.getLogger(HubClient.class);
    public static final int QUEUE_CAPACITY = 256;
    private static final long POLL_MS = 200L;

    private final long id;
    private final HubTransport transport;
    private final BlockingQueue<WatchSnapshot> queue;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final Consumer<HubClient> onTransportError;
    private final Thread writer;
    private volatile boolean subscribedToAll;
    private volatile boolean closed;

    HubClient(long id, HubTransport transport, int capacity, Consumer<HubClient> onTransportError) {
        this.id = id;
        this.transport = transport;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onTransportError = onTransportError;
        this.writer = new Thread(this::drain, "uabridge-hub-client-" + id);
        this.writer.setDaemon(true);
    }

    void start() {
        writer.start();
    }

    public long id() {
        return id;
    }

    public String remoteAddress() {
        return transport.remoteAddress();
    }

    public boolean isClosed() {
        return closed;
    }

    boolean matches(String nodeId) {
        return subscribedToAll || subscriptions.contains(nodeId);
    }

    void subscribe(List<String> nodeIds) {
        subscriptions.addAll(nodeIds);
    }

    void unsubscribe(List<String> nodeIds) {
        nodeIds.forEach(subscriptions::remove);
    }

    void setSubscribedToAll(boolean all) {
        this.subscribedToAll = all;
    }

    // Non-blocking; false when the queue is full or already closed.
    boolean offer(WatchSnapshot message) {
        return !closed && queue.offer(message);
    }

    /**
     * Stops accepting messages. The writer flushes nothing further and closes the transport.
     */
    void closeQueue() {
        if (closed) {
            return;
        }
        closed = true;
        queue.clear();
        writer.interrupt();
    }

    public ClientInfo info() {
        if (subscribedToAll) {
            return new ClientInfo(remoteAddress(), List.of("*"));
        }
        List<String> ids = new ArrayList<>(subscriptions);
        ids.sort(String::compareTo);
        return new ClientInfo(remoteAddress(), ids);
    }

    private void drain() {
        try {
            while (!closed) {
                WatchSnapshot message = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (message == null || closed) {
                    continue;
                }
                transport.send(Jsons.toCompactJson(message));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            log.info("Hub client {} ({}) write failed: {}", id, remoteAddress(), e.toString());
            onTransportError.accept(this);
        } finally {
            transport.close();
        }
    }
}
