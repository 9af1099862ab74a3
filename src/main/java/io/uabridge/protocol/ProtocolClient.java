package io.uabridge.protocol;

import java.time.Duration;

/**
 * Opens sessions against an automation data server.
 */
public interface ProtocolClient {
    ProtocolSession open(SessionOptions options, Duration timeout) throws ProtocolException;
}
