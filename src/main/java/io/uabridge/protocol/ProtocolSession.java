package io.uabridge.protocol;

import java.time.Duration;
import java.util.List;

/**
 * A live session. Every network call takes its own deadline; implementations raise
 * {@link ProtocolException.Kind#TIMEOUT} when it expires.
 */
public interface ProtocolSession extends AutoCloseable {
    String endpointUrl();

    List<BrowseReference> browse(String nodeId, Duration timeout) throws ProtocolException;

    /**
     * Reads the given attributes of one node. The result is aligned with {@code attributes};
     * attributes the node does not carry come back with a bad status.
     */
    List<AttributeValue> readAttributes(String nodeId, List<AttributeId> attributes, Duration timeout)
            throws ProtocolException;

    void write(String nodeId, TypedValue value, Duration timeout) throws ProtocolException;

    MonitorHandle monitor(String nodeId, DataChangeListener listener) throws ProtocolException;

    @Override
    void close() throws ProtocolException;
}
