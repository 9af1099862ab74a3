package io.uabridge.runtime;

import io.uabridge.model.AddressSpaceNode;
import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.FakeNode;
import io.uabridge.protocol.FakeProtocolClient;
import io.uabridge.protocol.FakeProtocolSession;
import io.uabridge.protocol.NodeClass;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class AddressSpaceCacheTest {

    @Test
    void browsePublishesChildrenSortedByName() throws Exception {
        FakeProtocolClient server = plant();
        FakeProtocolSession session = server.openSession();
        List<String> changed = new CopyOnWriteArrayList<>();
        AddressSpaceCache cache = new AddressSpaceCache(() -> session, changed::add);

        Assertions.assertFalse(cache.hasBrowseBeenPerformed("ns=2;s=Line1"));
        Assertions.assertEquals(AddressSpaceCache.BrowseOutcome.BROWSED, cache.browse("ns=2;s=Line1"));

        Assertions.assertTrue(cache.hasBrowseBeenPerformed("ns=2;s=Line1"));
        Assertions.assertEquals(List.of("ns=2;s=Pressure", "ns=2;s=Pump", "ns=2;s=Speed"), cache.children("ns=2;s=Line1"));
        AddressSpaceNode pump = cache.node("ns=2;s=Pump");
        Assertions.assertEquals(NodeClass.OBJECT, pump.nodeClass());
        Assertions.assertTrue(pump.hasChildren());
        Assertions.assertFalse(cache.node("ns=2;s=Speed").hasChildren());
        Assertions.assertEquals(List.of("ns=2;s=Line1"), changed);
    }

    @Test
    void concurrentBrowsesOfOneParentHitTheNetworkOnce() throws Exception {
        FakeProtocolClient server = plant();
        server.setBrowseDelay(Duration.ofMillis(300));
        FakeProtocolSession session = server.openSession();
        AddressSpaceCache cache = new AddressSpaceCache(() -> session, parent -> { });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AddressSpaceCache.BrowseOutcome>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.browse("ns=2;s=Line1");
                }));
            }
            start.countDown();
            int browsed = 0;
            int inFlight = 0;
            for (Future<AddressSpaceCache.BrowseOutcome> result : results) {
                AddressSpaceCache.BrowseOutcome outcome = result.get(10, TimeUnit.SECONDS);
                if (outcome == AddressSpaceCache.BrowseOutcome.BROWSED) {
                    browsed++;
                } else if (outcome == AddressSpaceCache.BrowseOutcome.ALREADY_IN_FLIGHT) {
                    inFlight++;
                }
            }
            Assertions.assertEquals(1, browsed);
            Assertions.assertEquals(7, inFlight);
            Assertions.assertEquals(1, server.browseCount("ns=2;s=Line1"));
            Assertions.assertFalse(cache.isBrowsing("ns=2;s=Line1"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resetDuringBrowseDiscardsStaleResult() throws Exception {
        FakeProtocolClient server = plant();
        server.setBrowseDelay(Duration.ofMillis(400));
        FakeProtocolSession session = server.openSession();
        AddressSpaceCache cache = new AddressSpaceCache(() -> session, parent -> { });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<AddressSpaceCache.BrowseOutcome> pending = pool.submit(() -> cache.browse("ns=2;s=Line1"));
            long deadline = System.currentTimeMillis() + 5000;
            while (!cache.isBrowsing("ns=2;s=Line1") && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            cache.reset();

            Assertions.assertEquals(AddressSpaceCache.BrowseOutcome.FAILED, pending.get(10, TimeUnit.SECONDS));
            Assertions.assertFalse(cache.hasBrowseBeenPerformed("ns=2;s=Line1"));
            Assertions.assertEquals(0, cache.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedBrowseLeavesParentRetryable() throws Exception {
        FakeProtocolClient server = plant();
        FakeProtocolSession session = server.openSession();
        AddressSpaceCache cache = new AddressSpaceCache(() -> session, parent -> { });

        Assertions.assertEquals(AddressSpaceCache.BrowseOutcome.FAILED, cache.browse("ns=2;s=Missing"));
        Assertions.assertFalse(cache.hasBrowseBeenPerformed("ns=2;s=Missing"));

        AddressSpaceCache disconnected = new AddressSpaceCache(() -> null, parent -> { });
        Assertions.assertEquals(AddressSpaceCache.BrowseOutcome.FAILED, disconnected.browse("i=84"));
    }

    private static FakeProtocolClient plant() {
        FakeProtocolClient server = new FakeProtocolClient();
        server.addChild("i=85", FakeNode.folder("ns=2;s=Line1", "Line1"));
        server.addChild("ns=2;s=Line1", FakeNode.variable("ns=2;s=Speed", "Speed", BuiltinType.DOUBLE, 1.0));
        server.addChild("ns=2;s=Line1", FakeNode.folder("ns=2;s=Pump", "Pump"));
        server.addChild("ns=2;s=Line1", FakeNode.variable("ns=2;s=Pressure", "Pressure", BuiltinType.FLOAT, 2.0f));
        return server;
    }
}
