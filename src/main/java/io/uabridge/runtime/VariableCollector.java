package io.uabridge.runtime;

import io.uabridge.model.AddressSpaceNode;
import io.uabridge.model.NodeAttributes;
import io.uabridge.model.TagExportRecord;
import io.uabridge.protocol.NodeClass;
import io.uabridge.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Breadth-first walk that collects variable nodes below a starting node, browsing unknown
 * branches on demand. The visited set makes reference cycles harmless.
 */
final class VariableCollector {
    private static final Logger log = LoggerFactory.getLogger(VariableCollector.class);
    private static final long IN_FLIGHT_POLL_MS = 20L;

    @FunctionalInterface
    interface AttributeLookup {
        NodeAttributes read(String nodeId) throws ProtocolException;
    }

    private final AddressSpaceCache cache;
    private final AttributeLookup attributes;
    private final BooleanSupplier cancelled;

    VariableCollector(AddressSpaceCache cache, AttributeLookup attributes, BooleanSupplier cancelled) {
        this.cache = cache;
        this.attributes = attributes;
        this.cancelled = cancelled;
    }

    TagCollection collect(String parentId, boolean recursive, Duration timeout) {
        String start = parentId == null || parentId.isBlank() ? AddressSpaceCache.OBJECTS_FOLDER : parentId.trim();
        long deadlineNs = System.nanoTime() + timeout.toNanos();

        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        Map<String, String> paths = new HashMap<>();
        List<TagExportRecord> tags = new ArrayList<>();
        queue.add(start);
        paths.put(start, "");

        while (!queue.isEmpty()) {
            if (cancelled.getAsBoolean()) {
                return new TagCollection(tags, "session closed during traversal");
            }
            if (System.nanoTime() - deadlineNs > 0) {
                log.warn("Variable traversal below {} timed out after {} tags", start, tags.size());
                return new TagCollection(tags, TagCollection.TIMEOUT_ERROR);
            }
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            List<String> childIds = List.of();
            if (recursive || id.equals(start)) {
                ensureBrowsed(id, deadlineNs);
                childIds = cache.children(id);
            }

            AddressSpaceNode node = cache.node(id);
            if (node != null && node.nodeClass() == NodeClass.VARIABLE) {
                String dataType = "";
                String description = "";
                try {
                    NodeAttributes attrs = attributes.read(id);
                    dataType = attrs.dataType();
                    description = attrs.description();
                } catch (ProtocolException e) {
                    log.debug("Attribute read failed for {} during traversal: {}", id, e.getMessage());
                }
                tags.add(new TagExportRecord(id, node.name(), dataType, description, paths.getOrDefault(id, node.name())));
            }

            String parentPath = paths.getOrDefault(id, "");
            for (String childId : childIds) {
                if (visited.contains(childId)) {
                    continue;
                }
                AddressSpaceNode child = cache.node(childId);
                String childName = child == null ? childId : child.name();
                paths.putIfAbsent(childId, parentPath.isEmpty() ? childName : parentPath + "/" + childName);
                if (recursive) {
                    queue.add(childId);
                } else if (child != null && child.nodeClass() == NodeClass.VARIABLE) {
                    queue.add(childId);
                }
            }
        }
        return new TagCollection(tags, null);
    }

    private void ensureBrowsed(String id, long deadlineNs) {
        if (cache.hasBrowseBeenPerformed(id)) {
            return;
        }
        if (cache.browse(id) != AddressSpaceCache.BrowseOutcome.ALREADY_IN_FLIGHT) {
            return;
        }
        // Another caller owns the browse; wait for it to publish.
        while (cache.isBrowsing(id) && System.nanoTime() - deadlineNs < 0 && !cancelled.getAsBoolean()) {
            try {
                Thread.sleep(IN_FLIGHT_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
