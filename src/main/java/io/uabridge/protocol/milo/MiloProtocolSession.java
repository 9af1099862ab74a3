package io.uabridge.protocol.milo;

import io.uabridge.protocol.AttributeId;
import io.uabridge.protocol.AttributeValue;
import io.uabridge.protocol.BrowseReference;
import io.uabridge.protocol.DataChangeListener;
import io.uabridge.protocol.MonitorHandle;
import io.uabridge.protocol.NodeClass;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;
import io.uabridge.protocol.TypedValue;
import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaMonitoredItem;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaSubscription;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.ByteString;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.BrowseDirection;
import org.eclipse.milo.opcua.stack.core.types.enumerated.BrowseResultMask;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseDescription;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseNextResponse;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseResult;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoredItemCreateRequest;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoringParameters;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadResponse;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;
import org.eclipse.milo.opcua.stack.core.types.structured.ReferenceDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * One connected Milo client. Monitored items share a single subscription created on first use.
 */
final class MiloProtocolSession implements ProtocolSession {
    private static final Logger log = LoggerFactory.getLogger(MiloProtocolSession.class);
    private static final double PUBLISHING_INTERVAL_MS = 1000.0;
    private static final double SAMPLING_INTERVAL_MS = 1000.0;
    private static final int MONITOR_QUEUE_SIZE = 10;
    private static final Duration MONITOR_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final OpcUaClient client;
    private final String endpointUrl;
    private final Object subscriptionLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private UaSubscription subscription;

    MiloProtocolSession(OpcUaClient client, String endpointUrl) {
        this.client = client;
        this.endpointUrl = endpointUrl;
    }

    @Override
    public String endpointUrl() {
        return endpointUrl;
    }

    @Override
    public List<BrowseReference> browse(String nodeId, Duration timeout) throws ProtocolException {
        BrowseDescription description = new BrowseDescription(
                parse(nodeId),
                BrowseDirection.Forward,
                Identifiers.HierarchicalReferences,
                true,
                uint(0),
                uint(BrowseResultMask.All.getValue())
        );
        long deadline = System.nanoTime() + timeout.toNanos();
        List<BrowseReference> out = new ArrayList<>();
        BrowseResult result = await("browse " + nodeId, client.browse(description), timeout);
        while (true) {
            checkStatus("browse " + nodeId, result.getStatusCode());
            ReferenceDescription[] references = result.getReferences();
            if (references != null) {
                for (ReferenceDescription reference : references) {
                    out.add(toReference(reference));
                }
            }
            ByteString continuation = result.getContinuationPoint();
            if (continuation == null || continuation.isNull() || continuation.length() == 0) {
                return out;
            }
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                throw new ProtocolException(ProtocolException.Kind.TIMEOUT, "browse " + nodeId + " timed out");
            }
            BrowseNextResponse next = await("browse next " + nodeId, client.browseNext(false, List.of(continuation)), remaining);
            BrowseResult[] results = next.getResults();
            if (results == null || results.length == 0) {
                return out;
            }
            result = results[0];
        }
    }

    @Override
    public List<AttributeValue> readAttributes(String nodeId, List<AttributeId> attributes, Duration timeout)
            throws ProtocolException {
        NodeId id = parse(nodeId);
        List<ReadValueId> reads = new ArrayList<>(attributes.size());
        for (AttributeId attribute : attributes) {
            reads.add(new ReadValueId(id, uint(attribute.id()), null, QualifiedName.NULL_VALUE));
        }
        ReadResponse response = await("read " + nodeId, client.read(0.0, TimestampsToReturn.Both, reads), timeout);
        DataValue[] results = response.getResults();
        List<AttributeValue> out = new ArrayList<>(attributes.size());
        for (int i = 0; i < attributes.size(); i++) {
            DataValue value = results != null && i < results.length ? results[i] : null;
            out.add(MiloValues.toAttributeValue(value));
        }
        return out;
    }

    @Override
    public void write(String nodeId, TypedValue value, Duration timeout) throws ProtocolException {
        DataValue dataValue = new DataValue(MiloValues.toVariant(value), null, null);
        StatusCode status = await("write " + nodeId, client.writeValue(parse(nodeId), dataValue), timeout);
        checkStatus("write " + nodeId, status);
    }

    @Override
    public MonitorHandle monitor(String nodeId, DataChangeListener listener) throws ProtocolException {
        UaSubscription current = subscription();
        ReadValueId readValueId = new ReadValueId(parse(nodeId), uint(AttributeId.VALUE.id()), null, QualifiedName.NULL_VALUE);
        UInteger handle = current.nextClientHandle();
        MonitoringParameters parameters = new MonitoringParameters(handle, SAMPLING_INTERVAL_MS, null, uint(MONITOR_QUEUE_SIZE), true);
        MonitoredItemCreateRequest request = new MonitoredItemCreateRequest(readValueId, MonitoringMode.Reporting, parameters);
        List<UaMonitoredItem> items = await("monitor " + nodeId,
                current.createMonitoredItems(
                        TimestampsToReturn.Both,
                        List.of(request),
                        (item, index) -> item.setValueConsumer(value -> listener.onDataChange(nodeId, MiloValues.toAttributeValue(value)))
                ),
                MONITOR_TIMEOUT);
        if (items.isEmpty()) {
            throw new ProtocolException(ProtocolException.Kind.FAILURE, "monitor " + nodeId + " returned no item");
        }
        UaMonitoredItem item = items.get(0);
        if (item.getStatusCode() != null && item.getStatusCode().isBad()) {
            throw MiloErrors.fromStatus("monitor " + nodeId, item.getStatusCode(), null);
        }
        return new MiloMonitorHandle(nodeId, current, item);
    }

    @Override
    public void close() throws ProtocolException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            client.getSubscriptionManager().clearSubscriptions();
        } catch (RuntimeException e) {
            log.debug("Clearing subscriptions failed: {}", e.getMessage());
        }
        await("disconnect", client.disconnect(), CLOSE_TIMEOUT);
    }

    private UaSubscription subscription() throws ProtocolException {
        synchronized (subscriptionLock) {
            if (subscription == null) {
                subscription = await("create subscription",
                        client.getSubscriptionManager().createSubscription(PUBLISHING_INTERVAL_MS), MONITOR_TIMEOUT);
            }
            return subscription;
        }
    }

    private BrowseReference toReference(ReferenceDescription reference) {
        ExpandedNodeId expanded = reference.getNodeId();
        String localId = null;
        String expandedId = null;
        if (expanded != null) {
            expandedId = expanded.toParseableString();
            localId = expanded.local(client.getNamespaceTable()).map(NodeId::toParseableString).orElse(null);
        }
        String name = reference.getDisplayName() == null || reference.getDisplayName().getText() == null
                ? ""
                : reference.getDisplayName().getText();
        NodeClass nodeClass = reference.getNodeClass() == null
                ? NodeClass.UNSPECIFIED
                : NodeClass.fromValue(reference.getNodeClass().getValue());
        return new BrowseReference(localId, expandedId, name, nodeClass);
    }

    private static NodeId parse(String nodeId) throws ProtocolException {
        return NodeId.parseSafe(nodeId == null ? "" : nodeId.trim())
                .orElseThrow(() -> new ProtocolException(ProtocolException.Kind.FAILURE, "invalid node id: " + nodeId));
    }

    private static void checkStatus(String operation, StatusCode status) throws ProtocolException {
        if (status != null && status.isBad()) {
            throw MiloErrors.fromStatus(operation, status, null);
        }
    }

    static <T> T await(String operation, CompletableFuture<T> future, Duration timeout) throws ProtocolException {
        try {
            return future.get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ProtocolException(ProtocolException.Kind.FAILURE, operation + " interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProtocolException(ProtocolException.Kind.TIMEOUT, operation + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw MiloErrors.translate(operation, e.getCause());
        }
    }

    private static final class MiloMonitorHandle implements MonitorHandle {
        private final String nodeId;
        private final UaSubscription subscription;
        private final UaMonitoredItem item;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private MiloMonitorHandle(String nodeId, UaSubscription subscription, UaMonitoredItem item) {
            this.nodeId = nodeId;
            this.subscription = subscription;
            this.item = item;
        }

        @Override
        public String nodeId() {
            return nodeId;
        }

        @Override
        public void close() throws ProtocolException {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            List<StatusCode> results = await("unmonitor " + nodeId, subscription.deleteMonitoredItems(List.of(item)), MONITOR_TIMEOUT);
            if (!results.isEmpty()) {
                checkStatus("unmonitor " + nodeId, results.get(0));
            }
        }
    }
}
