package io.uabridge.runtime;

import io.uabridge.model.NodeAttributes;
import io.uabridge.model.StatusCodeInfo;
import io.uabridge.model.WatchSnapshot;
import io.uabridge.protocol.AttributeValue;
import io.uabridge.protocol.MonitorHandle;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Monitored nodes and their latest value and quality, keyed by node id.
 *
 * <p>Each entry owns at most one monitor handle. Handles are always closed outside the lock,
 * and a handle that arrives for an entry removed in the meantime is closed by the adder, so
 * every acquired handle is released exactly once.
 */
public final class WatchManager {
    private static final Logger log = LoggerFactory.getLogger(WatchManager.class);
    private static final String NIL_VALUE = "<nil>";

    private final Supplier<ProtocolSession> sessionSupplier;
    private final VariableCollector.AttributeLookup attributes;
    private final Supplier<BroadcastChannel> broadcast;
    private final Consumer<List<WatchSnapshot>> snapshotListener;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock.
    private Map<String, WatchEntry> items = new HashMap<>();

    WatchManager(
            Supplier<ProtocolSession> sessionSupplier,
            VariableCollector.AttributeLookup attributes,
            Supplier<BroadcastChannel> broadcast,
            Consumer<List<WatchSnapshot>> snapshotListener
    ) {
        this.sessionSupplier = sessionSupplier;
        this.attributes = attributes;
        this.broadcast = broadcast;
        this.snapshotListener = snapshotListener;
    }

    /**
     * Starts watching {@code nodeId}. Returns false when there is no session or the node is
     * already watched. A failed monitor setup is logged and the entry is kept with its seeded
     * value.
     */
    public boolean addWatch(String nodeId) {
        ProtocolSession session = sessionSupplier.get();
        if (session == null) {
            log.warn("AddWatch failed: not connected (node {})", nodeId);
            return false;
        }
        WatchEntry entry = new WatchEntry(nodeId);
        lock.writeLock().lock();
        try {
            if (items.containsKey(nodeId)) {
                return false;
            }
            items.put(nodeId, entry);
        } finally {
            lock.writeLock().unlock();
        }

        try {
            NodeAttributes attrs = attributes.read(nodeId);
            lock.writeLock().lock();
            try {
                entry.name = attrs.name();
                entry.dataType = attrs.dataType();
                entry.value = attrs.value();
                entry.timestamp = ValueFormatter.watchTimestamp(Instant.now());
            } finally {
                lock.writeLock().unlock();
            }
        } catch (ProtocolException e) {
            log.debug("Seed read failed for {}: {}", nodeId, e.getMessage());
        }

        MonitorHandle handle = null;
        try {
            handle = session.monitor(nodeId, this::handleDataChange);
            log.info("Monitoring {} started", nodeId);
        } catch (ProtocolException e) {
            log.warn("Failed to monitor {}: {}", nodeId, e.getMessage());
        }

        WatchSnapshot added = null;
        boolean stillPresent;
        lock.writeLock().lock();
        try {
            stillPresent = items.get(nodeId) == entry;
            if (stillPresent) {
                entry.handle = handle;
                added = entry.toSnapshot();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (!stillPresent) {
            release(nodeId, handle);
            return false;
        }
        publish(snapshot());
        offerBroadcast(added);
        return true;
    }

    public boolean removeWatch(String nodeId) {
        WatchEntry removed;
        lock.writeLock().lock();
        try {
            removed = items.remove(nodeId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        release(nodeId, removed.handle);
        publish(snapshot());
        return true;
    }

    public void removeAllWatches() {
        Map<String, WatchEntry> old;
        lock.writeLock().lock();
        try {
            old = items;
            items = new HashMap<>();
        } finally {
            lock.writeLock().unlock();
        }
        for (WatchEntry entry : old.values()) {
            release(entry.nodeId, entry.handle);
        }
        publish(List.of());
    }

    /**
     * Sole ingress for live updates. Unknown node ids are ignored. The hub copy is dropped when
     * the broadcast channel is full; local state and the snapshot are updated regardless.
     */
    public void handleDataChange(String nodeId, AttributeValue value) {
        WatchSnapshot changed;
        lock.writeLock().lock();
        try {
            WatchEntry entry = items.get(nodeId);
            if (entry == null) {
                return;
            }
            if (value == null || !value.hasValue()) {
                entry.value = NIL_VALUE;
            } else {
                entry.value = ValueFormatter.formatValue(value.value(), entry.dataType);
            }
            entry.status = StatusCodeDecoder.decode(value == null ? AttributeValue.GOOD : value.statusCode());
            entry.timestamp = ValueFormatter.watchTimestamp(Instant.now());
            changed = entry.toSnapshot();
        } finally {
            lock.writeLock().unlock();
        }
        publish(snapshot());
        if (!offerBroadcast(changed)) {
            log.debug("Broadcast channel full, dropped update for {}", nodeId);
        }
    }

    // Sorted by node id.
    public List<WatchSnapshot> snapshot() {
        List<WatchSnapshot> out;
        lock.readLock().lock();
        try {
            out = new ArrayList<>(items.size());
            for (WatchEntry entry : items.values()) {
                out.add(entry.toSnapshot());
            }
        } finally {
            lock.readLock().unlock();
        }
        out.sort(Comparator.comparing(WatchSnapshot::nodeId));
        return out;
    }

    public boolean contains(String nodeId) {
        lock.readLock().lock();
        try {
            return items.containsKey(nodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return items.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    void publishSnapshot() {
        publish(snapshot());
    }

    private void publish(List<WatchSnapshot> watches) {
        if (snapshotListener != null) {
            snapshotListener.accept(watches);
        }
    }

    private boolean offerBroadcast(WatchSnapshot message) {
        BroadcastChannel channel = broadcast.get();
        return channel != null && channel.offer(message);
    }

    private static void release(String nodeId, MonitorHandle handle) {
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (ProtocolException e) {
            log.warn("Failed to release monitor for {}: {}", nodeId, e.getMessage());
        }
    }

    private static final class WatchEntry {
        private final String nodeId;
        private String name = "";
        private String dataType = "";
        private String value = "";
        private String timestamp = "";
        private StatusCodeInfo status = StatusCodeDecoder.decode(AttributeValue.GOOD);
        private MonitorHandle handle;

        private WatchEntry(String nodeId) {
            this.nodeId = nodeId;
        }

        private WatchSnapshot toSnapshot() {
            return new WatchSnapshot(
                    nodeId,
                    name,
                    dataType,
                    value,
                    timestamp,
                    status.severity(),
                    status.symbolicName(),
                    status.subCode(),
                    status.structureChanged(),
                    status.semanticsChanged(),
                    status.infoBits(),
                    status.rawCode()
            );
        }
    }
}
