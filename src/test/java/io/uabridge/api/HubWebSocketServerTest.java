package io.uabridge.api;

import io.uabridge.hub.BroadcastHub;
import io.uabridge.hub.HubBackend;
import io.uabridge.model.WatchSnapshot;
import io.uabridge.runtime.BroadcastChannel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class HubWebSocketServerTest {

    @Test
    void refusesSubscribersWhileDisconnected() throws Exception {
        StubBackend backend = new StubBackend();
        backend.connected.set(false);
        try (BroadcastHub hub = new BroadcastHub(backend)) {
            hub.start();
            HubWebSocketServer server = new HubWebSocketServer(hub, backend::isConnected);
            server.start(0);
            try {
                HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
                HttpResponse<String> refused = http.send(
                        HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/ws/subscribe")).GET().build(),
                        HttpResponse.BodyHandlers.ofString());
                Assertions.assertEquals(503, refused.statusCode());
                Assertions.assertTrue(refused.body().contains("OPC UA client not connected"));

                HttpResponse<String> unknown = http.send(
                        HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/ws/other")).GET().build(),
                        HttpResponse.BodyHandlers.ofString());
                Assertions.assertEquals(404, unknown.statusCode());
            } finally {
                server.stop();
            }
            Assertions.assertFalse(server.isRunning());
        }
    }

    @Test
    void subscriberReceivesUpdatesForItsNodes() throws Exception {
        StubBackend backend = new StubBackend();
        try (BroadcastHub hub = new BroadcastHub(backend)) {
            hub.start();
            HubWebSocketServer server = new HubWebSocketServer(hub, backend::isConnected);
            server.start(0);
            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            WebSocket socket = HttpClient.newHttpClient().newWebSocketBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .buildAsync(URI.create("ws://127.0.0.1:" + server.port() + "/ws/subscribe"), new WebSocket.Listener() {
                        private final StringBuilder partial = new StringBuilder();

                        @Override
                        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                            partial.append(data);
                            if (last) {
                                received.add(partial.toString());
                                partial.setLength(0);
                            }
                            webSocket.request(1);
                            return null;
                        }
                    })
                    .get(10, TimeUnit.SECONDS);
            try {
                long deadline = System.currentTimeMillis() + 5000;
                while (hub.clientCount() == 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                Assertions.assertEquals(1, hub.clientCount());

                socket.sendText("{\"action\":\"subscribe\",\"node_ids\":[\"ns=2;s=Speed\"]}", true).get(5, TimeUnit.SECONDS);
                deadline = System.currentTimeMillis() + 5000;
                while (hub.clients().get(0).subscriptions().isEmpty() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }

                backend.channel.offer(snapshot("ns=2;s=Other", "ignored"));
                backend.channel.offer(snapshot("ns=2;s=Speed", "12.5"));

                String message = received.poll(5, TimeUnit.SECONDS);
                Assertions.assertNotNull(message);
                Assertions.assertTrue(message.contains("\"node_id\":\"ns=2;s=Speed\""), message);
                Assertions.assertTrue(message.contains("\"value\":\"12.5\""), message);
            } finally {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "done");
                server.stop();
            }
        }
    }

    private static WatchSnapshot snapshot(String nodeId, String value) {
        return new WatchSnapshot(nodeId, "Speed", "Double", value, "12:00:00.000",
                "Good", "Good", 0, false, false, 0, "0x00000000");
    }

    private static final class StubBackend implements HubBackend {
        private final BroadcastChannel channel = new BroadcastChannel();
        private final AtomicBoolean connected = new AtomicBoolean(true);

        @Override
        public BroadcastChannel currentChannel() {
            return channel;
        }

        @Override
        public boolean isConnected() {
            return connected.get();
        }

        @Override
        public boolean addWatch(String nodeId) {
            return true;
        }

        @Override
        public Optional<WatchSnapshot> currentSnapshot(String nodeId) {
            return Optional.empty();
        }
    }
}
