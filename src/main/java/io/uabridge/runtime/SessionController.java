package io.uabridge.runtime;

import io.uabridge.config.UaBridgeConfig;
import io.uabridge.model.AddressSpaceNode;
import io.uabridge.model.ConnectionState;
import io.uabridge.model.NodeAttributes;
import io.uabridge.model.StatusCodeInfo;
import io.uabridge.model.WatchSnapshot;
import io.uabridge.protocol.AttributeValue;
import io.uabridge.protocol.ProtocolClient;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;
import io.uabridge.protocol.SessionOptions;
import io.uabridge.security.SecureChannelProvisioner;
import io.uabridge.write.WriteEngine;
import io.uabridge.write.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the single live session and everything scoped to it: the generation token, the
 * address-space cache, the watch map and the broadcast channel.
 *
 * <p>State moves Idle, Connecting, Connected, Disconnecting, Idle. A failed connect falls
 * back to Idle. Each connect runs under a fresh {@link GenerationToken}; disconnect cancels
 * it before releasing anything, so no background task outlives its session.
 */
public final class SessionController {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    public static final Duration PUMP_PERIOD = Duration.ofMillis(33);
    public static final Duration COLLECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration GENERATION_DRAIN = Duration.ofSeconds(2);

    private final ProtocolClient client;
    private final List<ControllerListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition teardownDone = stateLock.newCondition();
    private final AtomicReference<BroadcastChannel> channel = new AtomicReference<>(new BroadcastChannel());
    private final AddressSpaceCache cache;
    private final WatchManager watches;
    private final WriteEngine writer;

    private volatile UaBridgeConfig config;
    private volatile ExternalListener externalListener;

    // Guarded by stateLock; volatile for lock-free readers.
    private volatile ConnectionState state = ConnectionState.IDLE;
    private volatile ProtocolSession session;
    private volatile GenerationToken generation;

    public SessionController(ProtocolClient client, UaBridgeConfig config) {
        this.client = client;
        this.config = config == null ? UaBridgeConfig.defaults() : config;
        this.cache = new AddressSpaceCache(this::session, this::fireAddressSpaceChanged);
        this.watches = new WatchManager(
                this::session,
                nodeId -> NodeAttributeReader.read(session(), nodeId),
                channel::get,
                this::fireWatchListUpdate
        );
        this.writer = new WriteEngine(this::readNodeAttributes);
    }

    public void addListener(ControllerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ControllerListener listener) {
        listeners.remove(listener);
    }

    public UaBridgeConfig config() {
        return config;
    }

    /**
     * Replaces the configuration used by the next connect. A live session is not affected.
     */
    public void setConfig(UaBridgeConfig config) {
        this.config = config;
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && session != null;
    }

    public String endpointUrl() {
        ProtocolSession current = session;
        return current == null ? "" : current.endpointUrl();
    }

    /**
     * The channel live updates are broadcast on. Disconnect closes it and installs a fresh one,
     * so readers re-fetch after observing {@link BroadcastChannel#isClosed()}.
     */
    public BroadcastChannel currentBroadcastChannel() {
        return channel.get();
    }

    public AddressSpaceCache addressSpace() {
        return cache;
    }

    public WatchManager watches() {
        return watches;
    }

    /**
     * Opens a session with the configured retry budget. A no-op while connecting or connected;
     * waits for a running disconnect to finish first.
     *
     * @throws ProtocolException the last attempt's error once the budget is exhausted
     */
    public void connect() throws ProtocolException {
        GenerationToken gen;
        stateLock.lock();
        try {
            while (state == ConnectionState.DISCONNECTING) {
                try {
                    teardownDone.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProtocolException(ProtocolException.Kind.FAILURE, "connect interrupted", e);
                }
            }
            if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
                return;
            }
            GenerationToken stale = generation;
            if (stale != null) {
                stale.cancel();
            }
            gen = GenerationToken.create();
            generation = gen;
            state = ConnectionState.CONNECTING;
        } finally {
            stateLock.unlock();
        }

        UaBridgeConfig cfg = config;
        SessionOptions options;
        try {
            options = SecureChannelProvisioner.provision(cfg);
        } catch (IllegalArgumentException | IOException | GeneralSecurityException e) {
            ProtocolException error = new ProtocolException(ProtocolException.Kind.FAILURE,
                    "Invalid connection settings: " + e.getMessage(), e);
            failConnect(gen, error);
            throw error;
        }

        int attempts = Math.max(1, cfg.retryAttempts());
        ProtocolException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (gen.isCancelled()) {
                last = new ProtocolException(ProtocolException.Kind.FAILURE, "connect cancelled");
                break;
            }
            log.info("Connecting to {} (attempt {}/{})", options.endpointUrl(), attempt, attempts);
            try {
                ProtocolSession opened = client.open(options, cfg.connectTimeout());
                if (!install(gen, opened)) {
                    closeQuietly(opened);
                    last = new ProtocolException(ProtocolException.Kind.FAILURE, "connect cancelled");
                    break;
                }
                onConnected(gen, opened);
                return;
            } catch (ProtocolException e) {
                last = e;
                if (e.isTimeout()) {
                    log.warn("Connect attempt {}/{} timed out after {} ms", attempt, attempts, cfg.connectTimeout().toMillis());
                } else {
                    log.warn("Connect attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                }
            }
            if (attempt < attempts && !pause(gen, cfg.retryDelay())) {
                break;
            }
        }
        if (last == null) {
            last = new ProtocolException(ProtocolException.Kind.FAILURE, "connect cancelled");
        }
        failConnect(gen, last);
        throw last;
    }

    /**
     * Tears the session down. Safe to call repeatedly and from any thread, including the
     * generation's own workers.
     */
    public void disconnect() {
        GenerationToken gen;
        stateLock.lock();
        try {
            if (state == ConnectionState.DISCONNECTING) {
                awaitTeardown();
                return;
            }
            if (state == ConnectionState.IDLE && session == null && generation == null) {
                return;
            }
            state = ConnectionState.DISCONNECTING;
            gen = generation;
            generation = null;
        } finally {
            stateLock.unlock();
        }
        if (gen != null) {
            gen.cancel();
        }

        // Handles are released while the session they belong to is still open.
        watches.removeAllWatches();

        ProtocolSession closing;
        stateLock.lock();
        try {
            closing = session;
            session = null;
        } finally {
            stateLock.unlock();
        }
        if (closing != null) {
            closeQuietly(closing);
            log.info("Disconnected from {}", closing.endpointUrl());
        }

        BroadcastChannel old = channel.getAndSet(new BroadcastChannel());
        old.close();
        cache.reset();

        stateLock.lock();
        try {
            state = ConnectionState.IDLE;
            teardownDone.signalAll();
        } finally {
            stateLock.unlock();
        }
        fire(listener -> listener.onConnectionStateChange(false, "", null));
        fire(ControllerListener::onAddressSpaceReset);

        if (gen != null && !GenerationToken.onGenerationThread()) {
            try {
                if (!gen.awaitTermination(GENERATION_DRAIN)) {
                    log.warn("Generation {} tasks still running after {} ms", gen.id(), GENERATION_DRAIN.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Stops the hosted listener, then disconnects.
     */
    public void shutdown() {
        ExternalListener listener = externalListener;
        if (listener != null && listener.isRunning()) {
            listener.stop();
        }
        disconnect();
    }

    public void setExternalListener(ExternalListener listener) {
        this.externalListener = listener;
    }

    /**
     * Starts, restarts or stops the hosted listener according to {@code apiEnabled}.
     */
    public void updateApiServerState(UaBridgeConfig newConfig) {
        this.config = newConfig;
        ExternalListener listener = externalListener;
        if (listener == null) {
            return;
        }
        if (listener.isRunning()) {
            listener.stop();
        }
        if (!newConfig.apiEnabled()) {
            log.info("API server disabled");
            return;
        }
        try {
            listener.start(newConfig);
        } catch (Exception e) {
            log.error("Failed to start API server on port {}", newConfig.apiPort(), e);
        }
    }

    public AddressSpaceCache.BrowseOutcome browse(String parentId) {
        return cache.browse(parentId);
    }

    /**
     * Schedules a browse on the current generation. Returns false when not connected.
     */
    public boolean browseAsync(String parentId) {
        GenerationToken gen = generation;
        return gen != null && gen.execute("browse " + parentId, () -> cache.browse(parentId));
    }

    public List<String> children(String parentId) {
        return cache.children(parentId);
    }

    public AddressSpaceNode node(String nodeId) {
        return cache.node(nodeId);
    }

    /**
     * Reads the display attributes of one node and hands them to observers.
     */
    public NodeAttributes readNodeAttributes(String nodeId) throws ProtocolException {
        NodeAttributes attributes = NodeAttributeReader.read(session, nodeId);
        fire(listener -> listener.onNodeAttributesUpdate(attributes));
        return attributes;
    }

    /**
     * A one-off snapshot of a node's current value, shaped like a live update.
     */
    public Optional<WatchSnapshot> currentSnapshot(String nodeId) {
        try {
            NodeAttributes attributes = NodeAttributeReader.read(session, nodeId);
            StatusCodeInfo status = StatusCodeDecoder.decode(AttributeValue.GOOD);
            return Optional.of(new WatchSnapshot(
                    attributes.nodeId(),
                    attributes.name(),
                    attributes.dataType(),
                    attributes.value(),
                    ValueFormatter.watchTimestamp(Instant.now()),
                    status.severity(),
                    status.symbolicName(),
                    status.subCode(),
                    status.structureChanged(),
                    status.semanticsChanged(),
                    status.infoBits(),
                    status.rawCode()
            ));
        } catch (ProtocolException e) {
            log.debug("Snapshot read of {} failed: {}", nodeId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Collects variables below {@code parentId} (the Objects folder when blank), bounded by
     * {@link #COLLECT_TIMEOUT}. A timeout returns the partial list with an error.
     */
    public TagCollection collectVariableNodes(String parentId, boolean recursive) {
        GenerationToken gen = generation;
        if (gen == null || session == null) {
            return new TagCollection(List.of(), "not connected");
        }
        VariableCollector collector = new VariableCollector(
                cache,
                nodeId -> NodeAttributeReader.read(session(), nodeId),
                gen::isCancelled
        );
        return collector.collect(parentId, recursive, COLLECT_TIMEOUT);
    }

    public boolean addWatch(String nodeId) {
        return watches.addWatch(nodeId);
    }

    public boolean removeWatch(String nodeId) {
        return watches.removeWatch(nodeId);
    }

    public List<WatchSnapshot> watchList() {
        return watches.snapshot();
    }

    /**
     * Runs the write engine on the current generation. The future completes with the outcome;
     * it completes with a failure straight away when not connected.
     */
    public CompletableFuture<WriteOutcome> writeValue(String nodeId, String dataType, String value) {
        GenerationToken gen = generation;
        ProtocolSession current = session;
        if (gen == null || current == null) {
            log.error("Not connected. Cannot write value to {}", nodeId);
            return CompletableFuture.completedFuture(WriteOutcome.failed(nodeId, 0, "not connected"));
        }
        CompletableFuture<WriteOutcome> result = new CompletableFuture<>();
        boolean scheduled = gen.execute("write " + nodeId, () -> result.complete(writer.write(current, nodeId, dataType, value)));
        if (!scheduled) {
            result.complete(WriteOutcome.failed(nodeId, 0, "not connected"));
        }
        return result;
    }

    ProtocolSession session() {
        return session;
    }

    private boolean install(GenerationToken gen, ProtocolSession opened) {
        stateLock.lock();
        try {
            if (generation != gen || gen.isCancelled()) {
                return false;
            }
            session = opened;
            state = ConnectionState.CONNECTED;
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private void onConnected(GenerationToken gen, ProtocolSession opened) {
        String url = opened.endpointUrl();
        log.info("Connected to {}", url);
        fire(listener -> listener.onConnectionStateChange(true, url, null));
        gen.scheduleAtFixedRate("watch-pump", watches::publishSnapshot, PUMP_PERIOD);
        gen.execute("initial-browse", () -> cache.browse(AddressSpaceCache.OBJECTS_FOLDER));
    }

    private void failConnect(GenerationToken gen, ProtocolException error) {
        boolean current;
        stateLock.lock();
        try {
            current = generation == gen;
            if (current) {
                generation = null;
                state = ConnectionState.IDLE;
            }
        } finally {
            stateLock.unlock();
        }
        gen.cancel();
        log.error("Failed to connect: {}", error.getMessage());
        if (current) {
            fire(listener -> listener.onConnectionStateChange(false, "", error));
        }
    }

    // Caller holds stateLock.
    private void awaitTeardown() {
        try {
            while (state == ConnectionState.DISCONNECTING) {
                teardownDone.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean pause(GenerationToken gen, Duration delay) {
        try {
            return gen.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void closeQuietly(ProtocolSession closing) {
        try {
            closing.close();
        } catch (ProtocolException e) {
            log.warn("Failed to close session: {}", e.getMessage());
        }
    }

    private void fireWatchListUpdate(List<WatchSnapshot> snapshot) {
        fire(listener -> listener.onWatchListUpdate(snapshot));
    }

    private void fireAddressSpaceChanged(String parentId) {
        fire(listener -> listener.onAddressSpaceChanged(parentId));
    }

    private void fire(Consumer<ControllerListener> event) {
        for (ControllerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Controller listener failed", e);
            }
        }
    }
}
