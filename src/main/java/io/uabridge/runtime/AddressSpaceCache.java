package io.uabridge.runtime;

import io.uabridge.model.AddressSpaceNode;
import io.uabridge.protocol.BrowseReference;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Lazily browsed view of the server's node hierarchy.
 *
 * <p>A parent with no children entry has not been browsed yet; an empty entry means it was
 * browsed and has no children. {@link #reset()} replaces every map, and a browse that started
 * before a reset discards its result instead of publishing into the new generation.
 */
public final class AddressSpaceCache {
    private static final Logger log = LoggerFactory.getLogger(AddressSpaceCache.class);

    public static final String OBJECTS_FOLDER = "i=84";
    public static final Duration BROWSE_TIMEOUT = Duration.ofSeconds(10);

    public enum BrowseOutcome {
        BROWSED,
        ALREADY_IN_FLIGHT,
        FAILED
    }

    private final Supplier<ProtocolSession> sessionSupplier;
    private final Consumer<String> changeListener;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock.
    private Map<String, AddressSpaceNode> nodes = new HashMap<>();
    private Map<String, List<String>> children = new HashMap<>();
    private long epoch;
    private volatile Set<String> browsing = ConcurrentHashMap.newKeySet();

    public AddressSpaceCache(Supplier<ProtocolSession> sessionSupplier, Consumer<String> changeListener) {
        this.sessionSupplier = sessionSupplier;
        this.changeListener = changeListener;
    }

    /**
     * Browses one level below {@code parentId} and publishes the result. Concurrent calls for the
     * same parent collapse into one network browse; the losers return
     * {@link BrowseOutcome#ALREADY_IN_FLIGHT} immediately. Failures are logged and leave the
     * parent unbrowsed so it can be retried.
     */
    public BrowseOutcome browse(String parentId) {
        Set<String> inFlight = browsing;
        if (!inFlight.add(parentId)) {
            return BrowseOutcome.ALREADY_IN_FLIGHT;
        }
        try {
            ProtocolSession session = sessionSupplier.get();
            if (session == null) {
                log.warn("Browse aborted for {}: client not connected", parentId);
                return BrowseOutcome.FAILED;
            }
            long startEpoch = currentEpoch();
            List<BrowseReference> references;
            try {
                references = session.browse(parentId, BROWSE_TIMEOUT);
            } catch (ProtocolException e) {
                log.warn("Browse failed for {}: {}", parentId, e.getMessage());
                return BrowseOutcome.FAILED;
            }

            Map<String, AddressSpaceNode> found = new LinkedHashMap<>();
            for (BrowseReference reference : references) {
                if (reference == null) {
                    continue;
                }
                String childId = reference.nodeId();
                if (childId == null || childId.isBlank()) {
                    childId = reference.expandedNodeId();
                }
                if (childId == null || childId.isBlank()) {
                    continue;
                }
                String name = reference.displayName();
                if (name == null || name.isBlank()) {
                    name = childId;
                }
                boolean hasChildren = reference.nodeClass() != null && reference.nodeClass().mayHaveChildren();
                found.put(childId, new AddressSpaceNode(childId, name, reference.nodeClass(), hasChildren));
            }
            List<AddressSpaceNode> ordered = new ArrayList<>(found.values());
            ordered.sort(Comparator.comparing(AddressSpaceNode::name).thenComparing(AddressSpaceNode::nodeId));
            List<String> childIds = new ArrayList<>(ordered.size());
            for (AddressSpaceNode node : ordered) {
                childIds.add(node.nodeId());
            }

            lock.writeLock().lock();
            try {
                if (epoch != startEpoch) {
                    log.debug("Discarding browse result for {} from a previous session", parentId);
                    return BrowseOutcome.FAILED;
                }
                nodes.putAll(found);
                children.put(parentId, List.copyOf(childIds));
            } finally {
                lock.writeLock().unlock();
            }
            log.debug("Browsed {}: {} children", parentId, childIds.size());
            notifyChanged(parentId);
            return BrowseOutcome.BROWSED;
        } finally {
            inFlight.remove(parentId);
        }
    }

    public boolean hasBrowseBeenPerformed(String nodeId) {
        lock.readLock().lock();
        try {
            return children.containsKey(nodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isBrowsing(String nodeId) {
        return browsing.contains(nodeId);
    }

    // Copy; empty when not browsed yet.
    public List<String> children(String parentId) {
        lock.readLock().lock();
        try {
            List<String> ids = children.get(parentId);
            return ids == null ? List.of() : List.copyOf(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    public AddressSpaceNode node(String nodeId) {
        lock.readLock().lock();
        try {
            return nodes.get(nodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            nodes = new HashMap<>();
            children = new HashMap<>();
            epoch++;
            browsing = ConcurrentHashMap.newKeySet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private long currentEpoch() {
        lock.readLock().lock();
        try {
            return epoch;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void notifyChanged(String parentId) {
        if (changeListener == null) {
            return;
        }
        try {
            changeListener.accept(parentId);
        } catch (RuntimeException e) {
            log.warn("Address space change listener failed for {}", parentId, e);
        }
    }
}
