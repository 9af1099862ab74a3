package io.uabridge.write;

import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.FakeNode;
import io.uabridge.protocol.FakeProtocolClient;
import io.uabridge.protocol.ProtocolSession;
import io.uabridge.protocol.TypedValue;
import io.uabridge.runtime.NodeAttributeReader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class WriteEngineTest {

    @Test
    void writesInt32LiteralAndReadsItBack() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Counter", "Counter", BuiltinType.INT32, 0).writable());
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Int32", "123");

        Assertions.assertTrue(outcome.success(), outcome.error());
        Assertions.assertEquals(1, outcome.attempts());
        Assertions.assertEquals(new TypedValue.Int32Value(123), outcome.value());
        Assertions.assertEquals(123, node.value());
    }

    @Test
    void serverDataTypeOverridesHint() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Setpoint", "Setpoint", BuiltinType.FLOAT, 0.0f).writable());
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Double", "3.14");

        Assertions.assertTrue(outcome.success(), outcome.error());
        Assertions.assertEquals(BuiltinType.FLOAT, outcome.value().type());
        Assertions.assertEquals(3.14f, (Float) node.value(), 0.0001f);
    }

    @Test
    void outOfRangeLiteralFailsWithoutWriting() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Small", "Small", BuiltinType.INT16, (short) 1).writable());
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Int16", "70000");

        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals(0, outcome.attempts());
        Assertions.assertTrue(outcome.error().contains("Int16"), outcome.error());
        Assertions.assertTrue(server.writes().isEmpty());
    }

    @Test
    void readOnlyNodeIsRejectedBeforeAnyWrite() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Locked", "Locked", BuiltinType.INT32, 5));
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Int32", "6");

        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals("node is not writable", outcome.error());
        Assertions.assertTrue(server.writes().isEmpty());
    }

    @Test
    void mismatchFallsBackToSingleElementArray() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Wrapped", "Wrapped", BuiltinType.INT32, 0)
                .writable()
                .accepting(value -> value instanceof TypedValue.ArrayValue array
                        && array.elementType() == BuiltinType.INT32
                        && array.elements().size() == 1));
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Int32", "5");

        Assertions.assertTrue(outcome.success(), outcome.error());
        Assertions.assertEquals(2, outcome.attempts());
        Assertions.assertTrue(outcome.value().isArray());
    }

    @Test
    void mismatchWalksLadderUntilServerAccepts() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Port", "Port", BuiltinType.INT32, 0)
                .writable()
                .accepting(value -> value instanceof TypedValue.UInt16Value));
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Int32", "7");

        Assertions.assertTrue(outcome.success(), outcome.error());
        Assertions.assertEquals(BuiltinType.UINT16, outcome.value().type());
        Assertions.assertTrue(outcome.attempts() > 2, "attempts=" + outcome.attempts());
        Assertions.assertEquals(7, node.value());
    }

    @Test
    void reportsExhaustionWhenEveryCandidateIsRejected() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Stubborn", "Stubborn", BuiltinType.INT32, 0)
                .writable()
                .accepting(value -> false));
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Int32", "1");

        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals("all fallback attempts exhausted", outcome.error());
        Assertions.assertEquals(server.writes().size(), outcome.attempts());
    }

    @Test
    void arrayNodeParsesBracketedList() throws Exception {
        FakeProtocolClient server = new FakeProtocolClient();
        FakeNode node = server.addChild("i=85", FakeNode.variable("ns=2;s=Levels", "Levels", BuiltinType.DOUBLE, null)
                .writable()
                .arrayRank(1));
        ProtocolSession session = open(server);

        WriteOutcome outcome = engine(session).write(session, node.nodeId(), "Double", "[1.5, 2, 3]");

        Assertions.assertTrue(outcome.success(), outcome.error());
        TypedValue.ArrayValue array = (TypedValue.ArrayValue) outcome.value();
        Assertions.assertEquals(3, array.elements().size());
        Assertions.assertEquals(new TypedValue.DoubleValue(1.5), array.elements().get(0));
    }

    private static WriteEngine engine(ProtocolSession session) {
        return new WriteEngine(nodeId -> NodeAttributeReader.read(session, nodeId));
    }

    private static ProtocolSession open(FakeProtocolClient server) throws Exception {
        return server.openSession();
    }
}
