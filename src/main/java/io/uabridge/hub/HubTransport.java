package io.uabridge.hub;

import java.io.IOException;

/**
 * Outbound side of one hub client's connection.
 */
public interface HubTransport {
    /**
     * Sends one text frame, blocking until it is handed to the network.
     */
    void send(String text) throws IOException;

    void close();

    String remoteAddress();
}
