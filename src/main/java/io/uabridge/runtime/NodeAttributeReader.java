package io.uabridge.runtime;

import io.uabridge.model.NodeAttributes;
import io.uabridge.protocol.AttributeId;
import io.uabridge.protocol.AttributeValue;
import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.LocalizedText;
import io.uabridge.protocol.NodeClass;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;

import java.time.Duration;
import java.util.List;

/**
 * Reads the display attributes of one node in a single round trip.
 */
public final class NodeAttributeReader {
    public static final Duration READ_TIMEOUT = Duration.ofSeconds(5);

    static final List<AttributeId> ATTRIBUTES = List.of(
            AttributeId.NODE_ID,
            AttributeId.NODE_CLASS,
            AttributeId.DISPLAY_NAME,
            AttributeId.DESCRIPTION,
            AttributeId.ACCESS_LEVEL,
            AttributeId.USER_ACCESS_LEVEL,
            AttributeId.DATA_TYPE,
            AttributeId.VALUE,
            AttributeId.VALUE_RANK,
            AttributeId.ARRAY_DIMENSIONS
    );

    private NodeAttributeReader() {
    }

    public static NodeAttributes read(ProtocolSession session, String nodeId) throws ProtocolException {
        return read(session, nodeId, READ_TIMEOUT);
    }

    /**
     * Attributes the server does not return are left empty; the user access level wins over the
     * node access level when it is present.
     */
    public static NodeAttributes read(ProtocolSession session, String nodeId, Duration timeout)
            throws ProtocolException {
        if (session == null) {
            throw ProtocolException.notConnected();
        }
        if (nodeId == null || nodeId.isBlank()) {
            throw new ProtocolException(ProtocolException.Kind.FAILURE, "node id is required");
        }
        List<AttributeValue> results = session.readAttributes(nodeId, ATTRIBUTES, timeout);

        String resolvedId = "";
        String nodeClass = "";
        String name = "";
        String description = "";
        String dataType = "";
        int accessLevel = 0;
        int userAccessLevel = 0;
        int valueRank = -1;
        AttributeValue rawValue = null;

        for (int i = 0; i < results.size() && i < ATTRIBUTES.size(); i++) {
            AttributeValue result = results.get(i);
            if (result == null || !result.isGood() || !result.hasValue()) {
                continue;
            }
            Object value = result.value();
            switch (ATTRIBUTES.get(i)) {
                case NODE_ID -> resolvedId = String.valueOf(value);
                case NODE_CLASS -> {
                    if (value instanceof Number number) {
                        nodeClass = NodeClass.fromValue(number.intValue()).displayName();
                    }
                }
                case DISPLAY_NAME -> name = text(value);
                case DESCRIPTION -> description = text(value);
                case ACCESS_LEVEL -> accessLevel = intValue(value, 0);
                case USER_ACCESS_LEVEL -> userAccessLevel = intValue(value, 0);
                case DATA_TYPE -> dataType = BuiltinType.displayNameOf(String.valueOf(value));
                case VALUE -> rawValue = result;
                case VALUE_RANK -> valueRank = intValue(value, -1);
                default -> {
                }
            }
        }

        if (resolvedId.isBlank()) {
            resolvedId = nodeId;
        }
        String access = "";
        if (userAccessLevel > 0) {
            access = ValueFormatter.formatAccessLevel(userAccessLevel);
        } else if (accessLevel > 0) {
            access = ValueFormatter.formatAccessLevel(accessLevel);
        }
        String formatted = rawValue == null ? "" : ValueFormatter.formatValue(rawValue.value(), dataType);
        return new NodeAttributes(resolvedId, name, description, nodeClass, dataType, access, formatted, valueRank);
    }

    static String text(Object value) {
        if (value instanceof LocalizedText text) {
            return text.text() == null ? "" : text.text();
        }
        return value == null ? "" : String.valueOf(value);
    }

    private static int intValue(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return fallback;
    }
}
