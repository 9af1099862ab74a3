package io.uabridge.protocol;

/**
 * Live monitored item. Closing it removes the item from the server-side subscription.
 */
public interface MonitorHandle extends AutoCloseable {
    String nodeId();

    @Override
    void close() throws ProtocolException;
}
