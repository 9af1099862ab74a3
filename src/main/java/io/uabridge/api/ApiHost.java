package io.uabridge.api;

import io.uabridge.config.UaBridgeConfig;
import io.uabridge.hub.BroadcastHub;
import io.uabridge.hub.HubBackend;
import io.uabridge.runtime.ExternalListener;
import io.uabridge.runtime.SessionController;

/**
 * Hosts the REST server, the WebSocket endpoint and the hub behind them as one listener the
 * controller can start and stop.
 */
public final class ApiHost implements ExternalListener {
    private final SessionController controller;
    private BroadcastHub hub;
    private ApiServer api;
    private HubWebSocketServer webSocket;

    public ApiHost(SessionController controller) {
        this.controller = controller;
    }

    @Override
    public synchronized void start(UaBridgeConfig config) throws Exception {
        if (isRunning()) {
            return;
        }
        BroadcastHub newHub = new BroadcastHub(HubBackend.of(controller));
        newHub.start();
        ApiServer newApi = new ApiServer(controller, newHub::clients);
        HubWebSocketServer newWebSocket = new HubWebSocketServer(newHub, controller::isConnected);
        try {
            newApi.start(config.apiPort());
            newWebSocket.start(config.wsPort());
        } catch (Exception e) {
            newApi.stop();
            newWebSocket.stop();
            newHub.close();
            throw e;
        }
        hub = newHub;
        api = newApi;
        webSocket = newWebSocket;
    }

    @Override
    public synchronized void stop() {
        if (webSocket != null) {
            webSocket.stop();
            webSocket = null;
        }
        if (api != null) {
            api.stop();
            api = null;
        }
        if (hub != null) {
            hub.close();
            hub = null;
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return api != null && api.isRunning();
    }

    synchronized int apiPort() {
        return api == null ? -1 : api.port();
    }

    synchronized int webSocketPort() {
        return webSocket == null ? -1 : webSocket.port();
    }
}
