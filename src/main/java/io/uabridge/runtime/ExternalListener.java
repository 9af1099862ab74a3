package io.uabridge.runtime;

import io.uabridge.config.UaBridgeConfig;

/**
 * A network listener hosted next to the controller, such as the REST and WebSocket servers.
 * The controller starts and stops it but does not own it.
 */
public interface ExternalListener {
    void start(UaBridgeConfig config) throws Exception;

    void stop();

    boolean isRunning();
}
