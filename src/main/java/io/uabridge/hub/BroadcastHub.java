package io.uabridge.hub;

import io.uabridge.model.WatchSnapshot;
import io.uabridge.runtime.BroadcastChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans live updates out to subscribed clients.
 *
 * <p>A single coordinator thread owns the client set and processes register, unregister,
 * broadcast, generation-cancel and shutdown events in order. A forwarder thread reads the
 * runtime's current {@link BroadcastChannel}; when it sees the channel closed it reports the
 * generation cancel and rebinds to the replacement, so the hub survives reconnects.
 * A client whose queue is full is dropped rather than waited for.
 */
public final class BroadcastHub implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);
    private static final long CHANNEL_POLL_MS = 200L;
    private static final long REBIND_POLL_MS = 50L;

    private enum EventKind {
        REGISTER,
        UNREGISTER,
        BROADCAST,
        GENERATION_CANCELLED,
        SHUTDOWN
    }

    private record Event(EventKind kind, HubClient client, WatchSnapshot message) {
    }

    private final HubBackend backend;
    private final int clientCapacity;
    private final LinkedBlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final AtomicLong clientIds = new AtomicLong();
    private final ExecutorService controlExecutor;
    private final Thread coordinator;
    private final Thread forwarder;
    private volatile boolean running;
    private volatile List<HubClient> clientView = List.of();

    // Coordinator thread only.
    private final Map<Long, HubClient> clients = new LinkedHashMap<>();

    public BroadcastHub(HubBackend backend) {
        this(backend, HubClient.QUEUE_CAPACITY);
    }

    BroadcastHub(HubBackend backend, int clientCapacity) {
        this.backend = backend;
        this.clientCapacity = clientCapacity;
        this.coordinator = new Thread(this::coordinate, "uabridge-hub-coordinator");
        this.coordinator.setDaemon(true);
        this.forwarder = new Thread(this::forward, "uabridge-hub-forwarder");
        this.forwarder.setDaemon(true);
        this.controlExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "uabridge-hub-control");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        coordinator.start();
        forwarder.start();
        log.info("Broadcast hub started");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Binds a new client to {@code transport} and starts its writer.
     */
    public HubClient register(HubTransport transport) {
        HubClient client = new HubClient(clientIds.incrementAndGet(), transport, clientCapacity, this::unregister);
        client.start();
        events.add(new Event(EventKind.REGISTER, client, null));
        return client;
    }

    public void unregister(HubClient client) {
        events.add(new Event(EventKind.UNREGISTER, client, null));
    }

    /**
     * Applies one inbound control message. Filter changes take effect immediately; watch
     * creation and the one-shot snapshots run off the caller's thread. Malformed messages are
     * logged and ignored.
     */
    public void handleControl(HubClient client, String text) {
        ControlMessage message;
        ControlMessage.Action action;
        try {
            message = ControlMessage.parse(text);
            if (message == null) {
                throw new IllegalArgumentException("empty control message");
            }
            action = message.parsedAction();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed control message from {}: {}", client.remoteAddress(), e.getMessage());
            return;
        }
        switch (action) {
            case SUBSCRIBE -> {
                client.subscribe(message.nodeIds());
                submitControl(() -> primeSubscriptions(client, message.nodeIds()));
            }
            case UNSUBSCRIBE -> client.unsubscribe(message.nodeIds());
            case SUBSCRIBE_ALL -> client.setSubscribedToAll(true);
            case UNSUBSCRIBE_ALL -> client.setSubscribedToAll(false);
        }
    }

    /**
     * Clients as last published by the coordinator.
     */
    public List<ClientInfo> clients() {
        List<ClientInfo> out = new ArrayList<>();
        for (HubClient client : clientView) {
            out.add(client.info());
        }
        return out;
    }

    public int clientCount() {
        return clientView.size();
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        events.add(new Event(EventKind.SHUTDOWN, null, null));
        forwarder.interrupt();
        controlExecutor.shutdownNow();
        try {
            coordinator.join(TimeUnit.SECONDS.toMillis(2));
            forwarder.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Broadcast hub stopped");
    }

    private void primeSubscriptions(HubClient client, List<String> nodeIds) {
        for (String nodeId : nodeIds) {
            if (client.isClosed()) {
                return;
            }
            backend.addWatch(nodeId);
            backend.currentSnapshot(nodeId).ifPresent(snapshot -> {
                if (!client.offer(snapshot)) {
                    log.debug("Initial snapshot of {} dropped for client {}", nodeId, client.id());
                }
            });
        }
    }

    private void submitControl(Runnable task) {
        try {
            controlExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("Hub control task failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Hub is shutting down; control task dropped");
        }
    }

    private void coordinate() {
        try {
            while (true) {
                Event event = events.take();
                switch (event.kind()) {
                    case REGISTER -> {
                        clients.put(event.client().id(), event.client());
                        log.info("Hub client {} connected from {}", event.client().id(), event.client().remoteAddress());
                        publishView();
                    }
                    case UNREGISTER -> {
                        HubClient removed = clients.remove(event.client().id());
                        event.client().closeQueue();
                        if (removed != null) {
                            log.info("Hub client {} disconnected", removed.id());
                            publishView();
                        }
                    }
                    case BROADCAST -> fanOut(event.message());
                    case GENERATION_CANCELLED -> {
                        closeAll();
                        log.info("Session ended; hub clients closed");
                    }
                    case SHUTDOWN -> {
                        closeAll();
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeAll();
        }
    }

    private void fanOut(WatchSnapshot message) {
        boolean removedAny = false;
        Iterator<HubClient> it = clients.values().iterator();
        while (it.hasNext()) {
            HubClient client = it.next();
            if (!client.matches(message.nodeId())) {
                continue;
            }
            if (!client.offer(message)) {
                log.warn("Hub client {} ({}) is too slow; dropping it", client.id(), client.remoteAddress());
                client.closeQueue();
                it.remove();
                removedAny = true;
            }
        }
        if (removedAny) {
            publishView();
        }
    }

    private void closeAll() {
        for (HubClient client : clients.values()) {
            client.closeQueue();
        }
        clients.clear();
        publishView();
    }

    private void publishView() {
        clientView = List.copyOf(clients.values());
    }

    private void forward() {
        BroadcastChannel bound = backend.currentChannel();
        try {
            while (running) {
                WatchSnapshot message = bound.poll(CHANNEL_POLL_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    events.add(new Event(EventKind.BROADCAST, null, message));
                    continue;
                }
                if (bound.isClosed()) {
                    events.add(new Event(EventKind.GENERATION_CANCELLED, null, null));
                    BroadcastChannel next = backend.currentChannel();
                    while (running && next == bound) {
                        Thread.sleep(REBIND_POLL_MS);
                        next = backend.currentChannel();
                    }
                    bound = next;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
