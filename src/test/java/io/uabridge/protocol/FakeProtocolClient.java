package io.uabridge.protocol;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory server and client in one: holds the address space and opens sessions over it.
 */
public final class FakeProtocolClient implements ProtocolClient {
    final Map<String, FakeNode> nodes = new ConcurrentHashMap<>();
    final Map<String, AtomicInteger> browseCounts = new ConcurrentHashMap<>();
    final List<TypedValue> writes = new CopyOnWriteArrayList<>();
    final AtomicInteger monitorsOpened = new AtomicInteger();
    final AtomicInteger monitorsClosed = new AtomicInteger();
    private final List<FakeProtocolSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicInteger opens = new AtomicInteger();
    private volatile int failuresBeforeOpen;
    volatile Duration browseDelay = Duration.ZERO;
    volatile Runnable closeHook;

    public FakeProtocolClient() {
        add(FakeNode.folder("i=84", "Root"));
        add(FakeNode.folder("i=85", "Objects"));
        node("i=84").child("i=85");
    }

    public FakeNode add(FakeNode node) {
        nodes.put(node.nodeId, node);
        return node;
    }

    public FakeNode node(String nodeId) {
        return nodes.get(nodeId);
    }

    // Adds the node and links it below parentId.
    public FakeNode addChild(String parentId, FakeNode node) {
        add(node);
        nodes.get(parentId).child(node.nodeId);
        return node;
    }

    public void failNextOpens(int count) {
        failuresBeforeOpen = count;
    }

    /**
     * Runs inside every session close, before the session is marked closed.
     */
    public void onSessionClose(Runnable hook) {
        closeHook = hook;
    }

    public void setBrowseDelay(Duration delay) {
        browseDelay = delay;
    }

    public int opens() {
        return opens.get();
    }

    public int browseCount(String nodeId) {
        AtomicInteger count = browseCounts.get(nodeId);
        return count == null ? 0 : count.get();
    }

    public List<TypedValue> writes() {
        return List.copyOf(writes);
    }

    public int monitorsOpened() {
        return monitorsOpened.get();
    }

    public int monitorsClosed() {
        return monitorsClosed.get();
    }

    public List<FakeProtocolSession> sessions() {
        return List.copyOf(sessions);
    }

    public FakeProtocolSession lastSession() {
        return sessions.isEmpty() ? null : sessions.get(sessions.size() - 1);
    }

    public static SessionOptions options(String endpointUrl) {
        return new SessionOptions(endpointUrl, null, SecurityMode.NONE, UserIdentity.anonymous(null),
                "urn:uabridge:test", "urn:uabridge:test", "test", Duration.ofSeconds(60),
                null, null, null, null);
    }

    /**
     * Opens a session directly, bypassing the controller.
     */
    public FakeProtocolSession openSession() throws ProtocolException {
        return (FakeProtocolSession) open(options("opc.tcp://fake:4840"), Duration.ofSeconds(1));
    }

    @Override
    public ProtocolSession open(SessionOptions options, Duration timeout) throws ProtocolException {
        opens.incrementAndGet();
        if (failuresBeforeOpen > 0) {
            failuresBeforeOpen--;
            throw new ProtocolException(ProtocolException.Kind.FAILURE, "connection refused");
        }
        FakeProtocolSession session = new FakeProtocolSession(this, options.endpointUrl());
        sessions.add(session);
        return session;
    }
}
