package io.uabridge.hub;

import io.uabridge.model.WatchSnapshot;
import io.uabridge.runtime.BroadcastChannel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

final class BroadcastHubTest {

    @Test
    void deliversOnlySubscribedNodes() throws Exception {
        StubBackend backend = new StubBackend();
        try (BroadcastHub hub = new BroadcastHub(backend, 16)) {
            hub.start();
            RecordingTransport picky = new RecordingTransport("10.0.0.1:5000");
            RecordingTransport everything = new RecordingTransport("10.0.0.2:5000");
            HubClient first = hub.register(picky);
            HubClient second = hub.register(everything);
            hub.handleControl(first, "{\"action\":\"subscribe\",\"node_ids\":[\"ns=2;s=A\"]}");
            hub.handleControl(second, "{\"action\":\"subscribe_all\"}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 2));

            backend.channel.get().offer(snapshot("ns=2;s=A", "1"));
            backend.channel.get().offer(snapshot("ns=2;s=B", "2"));

            Assertions.assertTrue(waitFor(() -> everything.sent.size() >= 2));
            Assertions.assertTrue(waitFor(() -> picky.sent.stream().anyMatch(text -> text.contains("\"value\":\"1\""))));
            Thread.sleep(200);
            Assertions.assertTrue(picky.sent.stream().noneMatch(text -> text.contains("ns=2;s=B")));
            Assertions.assertEquals(List.of("ns=2;s=A"), backend.watched);
        }
    }

    @Test
    void subscribePrimesClientWithCurrentSnapshot() throws Exception {
        StubBackend backend = new StubBackend();
        backend.current = snapshot("ns=2;s=A", "primed");
        try (BroadcastHub hub = new BroadcastHub(backend, 16)) {
            hub.start();
            RecordingTransport transport = new RecordingTransport("peer");
            HubClient client = hub.register(transport);

            hub.handleControl(client, "{\"action\":\"subscribe\",\"node_ids\":[\"ns=2;s=A\"]}");

            Assertions.assertTrue(waitFor(() -> transport.sent.stream().anyMatch(text -> text.contains("primed"))));
        }
    }

    @Test
    void clientListReflectsFilters() throws Exception {
        try (BroadcastHub hub = new BroadcastHub(new StubBackend(), 16)) {
            hub.start();
            HubClient client = hub.register(new RecordingTransport("10.0.0.9:1234"));
            hub.handleControl(client, "{\"action\":\"subscribe\",\"node_ids\":[\"ns=2;s=Z\",\"ns=2;s=B\"]}");
            hub.handleControl(client, "{\"action\":\"unsubscribe\",\"node_ids\":[\"ns=2;s=Z\"]}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));

            ClientInfo info = hub.clients().get(0);
            Assertions.assertEquals("10.0.0.9:1234", info.remoteAddress());
            Assertions.assertEquals(List.of("ns=2;s=B"), info.subscriptions());

            hub.handleControl(client, "{\"action\":\"subscribe_all\"}");
            Assertions.assertEquals(List.of("*"), hub.clients().get(0).subscriptions());
            hub.handleControl(client, "{\"action\":\"unsubscribe_all\"}");
            Assertions.assertEquals(List.of("ns=2;s=B"), hub.clients().get(0).subscriptions());
        }
    }

    @Test
    void malformedControlMessagesAreIgnored() throws Exception {
        try (BroadcastHub hub = new BroadcastHub(new StubBackend(), 16)) {
            hub.start();
            HubClient client = hub.register(new RecordingTransport("peer"));
            hub.handleControl(client, "not json");
            hub.handleControl(client, "null");
            hub.handleControl(client, "{\"action\":\"explode\"}");
            hub.handleControl(client, "{\"node_ids\":[\"x\"]}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));
            Assertions.assertEquals(List.of(), hub.clients().get(0).subscriptions());
            Assertions.assertFalse(client.isClosed());
        }
    }

    @Test
    void saturatedClientIsDroppedWithoutStallingOthers() throws Exception {
        StubBackend backend = new StubBackend();
        try (BroadcastHub hub = new BroadcastHub(backend, 2)) {
            hub.start();
            CountDownLatch release = new CountDownLatch(1);
            RecordingTransport stuck = new RecordingTransport("slow");
            stuck.gate = release;
            RecordingTransport healthy = new RecordingTransport("fast");
            HubClient slow = hub.register(stuck);
            HubClient fast = hub.register(healthy);
            hub.handleControl(slow, "{\"action\":\"subscribe_all\"}");
            hub.handleControl(fast, "{\"action\":\"subscribe_all\"}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 2));

            for (int i = 0; i < 10; i++) {
                Assertions.assertTrue(backend.channel.get().offer(snapshot("ns=2;s=A", String.valueOf(i))));
                Thread.sleep(20);
            }

            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));
            Assertions.assertTrue(slow.isClosed());
            Assertions.assertFalse(fast.isClosed());
            Assertions.assertTrue(waitFor(() -> healthy.sent.size() == 10));
            release.countDown();
            Assertions.assertTrue(waitFor(() -> stuck.closed));
        }
    }

    @Test
    void failingTransportUnregistersClient() throws Exception {
        StubBackend backend = new StubBackend();
        try (BroadcastHub hub = new BroadcastHub(backend, 16)) {
            hub.start();
            RecordingTransport broken = new RecordingTransport("broken");
            broken.fail = true;
            HubClient client = hub.register(broken);
            hub.handleControl(client, "{\"action\":\"subscribe_all\"}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));

            backend.channel.get().offer(snapshot("ns=2;s=A", "1"));

            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 0));
            Assertions.assertTrue(waitFor(() -> broken.closed));
        }
    }

    @Test
    void transportRuntimeFailureUnregistersClient() throws Exception {
        StubBackend backend = new StubBackend();
        try (BroadcastHub hub = new BroadcastHub(backend, 16)) {
            hub.start();
            RecordingTransport broken = new RecordingTransport("broken");
            broken.failUnchecked = true;
            HubClient client = hub.register(broken);
            hub.handleControl(client, "{\"action\":\"subscribe_all\"}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));

            backend.channel.get().offer(snapshot("ns=2;s=A", "1"));

            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 0));
            Assertions.assertTrue(waitFor(() -> broken.closed));
            Assertions.assertTrue(client.isClosed());
        }
    }

    @Test
    void closedChannelDropsClientsAndRebindsToReplacement() throws Exception {
        StubBackend backend = new StubBackend();
        try (BroadcastHub hub = new BroadcastHub(backend, 16)) {
            hub.start();
            RecordingTransport before = new RecordingTransport("before");
            hub.register(before);
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));

            BroadcastChannel old = backend.channel.getAndSet(new BroadcastChannel());
            old.close();

            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 0));
            Assertions.assertTrue(waitFor(() -> before.closed));

            RecordingTransport after = new RecordingTransport("after");
            HubClient client = hub.register(after);
            hub.handleControl(client, "{\"action\":\"subscribe_all\"}");
            Assertions.assertTrue(waitFor(() -> hub.clientCount() == 1));
            backend.channel.get().offer(snapshot("ns=2;s=A", "fresh"));

            Assertions.assertTrue(waitFor(() -> after.sent.stream().anyMatch(text -> text.contains("fresh"))));
        }
    }

    private static WatchSnapshot snapshot(String nodeId, String value) {
        return new WatchSnapshot(nodeId, "name", "Int32", value, "12:00:00.000",
                "Good", "Good", 0, false, false, 0, "0x00000000");
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    private static final class StubBackend implements HubBackend {
        private final AtomicReference<BroadcastChannel> channel = new AtomicReference<>(new BroadcastChannel());
        private final List<String> watched = new CopyOnWriteArrayList<>();
        private volatile WatchSnapshot current;

        @Override
        public BroadcastChannel currentChannel() {
            return channel.get();
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public boolean addWatch(String nodeId) {
            watched.add(nodeId);
            return true;
        }

        @Override
        public Optional<WatchSnapshot> currentSnapshot(String nodeId) {
            WatchSnapshot snapshot = current;
            return snapshot != null && snapshot.nodeId().equals(nodeId) ? Optional.of(snapshot) : Optional.empty();
        }
    }

    private static final class RecordingTransport implements HubTransport {
        private final String address;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile CountDownLatch gate;
        private volatile boolean fail;
        private volatile boolean failUnchecked;
        private volatile boolean closed;

        private RecordingTransport(String address) {
            this.address = address;
        }

        @Override
        public void send(String text) throws IOException {
            if (fail) {
                throw new IOException("connection reset");
            }
            if (failUnchecked) {
                throw new IllegalStateException("channel already closed");
            }
            CountDownLatch block = gate;
            if (block != null) {
                try {
                    block.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            sent.add(text);
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public String remoteAddress() {
            return address;
        }
    }
}
