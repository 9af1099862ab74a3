package io.uabridge.write;

import io.uabridge.model.NodeAttributes;
import io.uabridge.protocol.AttributeId;
import io.uabridge.protocol.AttributeValue;
import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;
import io.uabridge.protocol.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Turns a string literal plus a type hint into an exactly-typed write, trusting the server's
 * declared data type over the hint, and walks a fixed fallback ladder when the server answers
 * with a type mismatch.
 */
public final class WriteEngine {
    private static final Logger log = LoggerFactory.getLogger(WriteEngine.class);

    public static final Duration WRITE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(2);

    static final List<BuiltinType> FALLBACK_CANDIDATES = List.of(
            BuiltinType.BYTE_STRING,
            BuiltinType.DOUBLE,
            BuiltinType.FLOAT,
            BuiltinType.INT64,
            BuiltinType.INT32,
            BuiltinType.INT16,
            BuiltinType.UINT64,
            BuiltinType.UINT32,
            BuiltinType.UINT16,
            BuiltinType.BOOLEAN,
            BuiltinType.STRING
    );

    // Types a probed current value may impose on a scalar write.
    private static final Set<BuiltinType> PROBE_PREFERRED = Set.of(
            BuiltinType.FLOAT,
            BuiltinType.DOUBLE,
            BuiltinType.INT16,
            BuiltinType.INT32,
            BuiltinType.INT64,
            BuiltinType.UINT16,
            BuiltinType.UINT32,
            BuiltinType.UINT64,
            BuiltinType.BOOLEAN
    );

    /**
     * Source of node metadata. The controller supplies one that also refreshes its listeners.
     */
    @FunctionalInterface
    public interface AttributeSource {
        NodeAttributes read(String nodeId) throws ProtocolException;
    }

    private final AttributeSource attributes;

    public WriteEngine(AttributeSource attributes) {
        this.attributes = attributes;
    }

    /**
     * Performs the write synchronously. Never throws: every failure is logged and reported in
     * the outcome.
     */
    public WriteOutcome write(ProtocolSession session, String nodeId, String typeHint, String literal) {
        if (session == null) {
            log.error("Not connected. Cannot write value to {}", nodeId);
            return WriteOutcome.failed(nodeId, 0, "not connected");
        }
        try {
            return doWrite(session, nodeId, typeHint == null ? "" : typeHint.trim(), literal == null ? "" : literal);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while writing {}", nodeId, e);
            return WriteOutcome.failed(nodeId, 0, "unexpected failure: " + e.getMessage());
        }
    }

    private WriteOutcome doWrite(ProtocolSession session, String nodeId, String typeHint, String literal) {
        String dataType = typeHint;
        int valueRank = -1;
        try {
            NodeAttributes attrs = attributes.read(nodeId);
            if (!attrs.writable()) {
                log.error("Node {} is not writable (AccessLevel={})", nodeId, attrs.accessLevel());
                return WriteOutcome.failed(nodeId, 0, "node is not writable");
            }
            valueRank = attrs.valueRank();
            if (!attrs.dataType().isBlank()) {
                if (!attrs.dataType().equalsIgnoreCase(typeHint)) {
                    log.info("Overriding provided DataType '{}' with server DataType '{}' for {}",
                            typeHint, attrs.dataType(), nodeId);
                }
                dataType = attrs.dataType();
            }
        } catch (ProtocolException e) {
            log.warn("Could not read attributes of {} ({}); using provided DataType '{}'",
                    nodeId, e.getMessage(), typeHint);
        }

        TypedValue value;
        try {
            value = initialValue(session, nodeId, dataType, valueRank, literal);
        } catch (ValueConversionException e) {
            log.error("Failed to convert value '{}' for {}: {}", literal, nodeId, e.getMessage());
            return WriteOutcome.failed(nodeId, 0, e.getMessage());
        }

        Attempts attempts = new Attempts(session, nodeId);
        ProtocolException failure = attempts.tryWrite(value);
        if (failure == null) {
            return WriteOutcome.succeeded(nodeId, value, attempts.count);
        }
        if (!failure.isTypeMismatch()) {
            log.error("Write to {} failed: {}", nodeId, failure.getMessage());
            return WriteOutcome.failed(nodeId, attempts.count, failure.getMessage());
        }

        log.warn("Server reported a type mismatch for {} ({}); trying fallbacks", nodeId, value.type().displayName());
        TypedValue accepted = fallback(attempts, value, dataType, literal);
        if (accepted != null) {
            return WriteOutcome.succeeded(nodeId, accepted, attempts.count);
        }
        log.error("All fallback attempts exhausted. Write to {} failed", nodeId);
        return WriteOutcome.failed(nodeId, attempts.count, "all fallback attempts exhausted");
    }

    private TypedValue initialValue(ProtocolSession session, String nodeId, String dataType, int valueRank, String literal)
            throws ValueConversionException {
        if (valueRank >= 0) {
            BuiltinType elementType = BuiltinType.fromName(dataType);
            if (elementType == null) {
                throw new ValueConversionException("array writes for type '" + dataType + "' are not supported");
            }
            return TypedValueParser.parseArray(literal, elementType);
        }
        BuiltinType probed = probeValueType(session, nodeId);
        if (probed != null && PROBE_PREFERRED.contains(probed)) {
            if (!probed.displayName().equalsIgnoreCase(dataType)) {
                log.debug("Current value of {} is {}; coercing literal to it", nodeId, probed.displayName());
            }
            return TypedValueParser.parseScalar(literal, probed);
        }
        return TypedValueParser.parseScalar(literal, dataType);
    }

    private BuiltinType probeValueType(ProtocolSession session, String nodeId) {
        try {
            List<AttributeValue> results = session.readAttributes(nodeId, List.of(AttributeId.VALUE), PROBE_TIMEOUT);
            if (results.isEmpty() || results.get(0) == null || !results.get(0).hasValue()) {
                return null;
            }
            AttributeValue current = results.get(0);
            if (current.value() instanceof List<?>) {
                return null;
            }
            return current.type();
        } catch (ProtocolException e) {
            log.debug("Value probe of {} failed: {}", nodeId, e.getMessage());
            return null;
        }
    }

    private TypedValue fallback(Attempts attempts, TypedValue first, String dataType, String literal) {
        if (!first.isArray() && !dataType.isBlank()) {
            BuiltinType serverType = BuiltinType.fromName(dataType);
            TypedValue scalar = convertQuietly(literal, serverType);
            if (scalar != null && !scalar.equals(first) && attempts.tryWrite(scalar) == null) {
                return scalar;
            }
            String element = stripBrackets(literal);
            TypedValue single = convertQuietly(element, serverType);
            if (single != null && TypedValueParser.isArrayElementType(serverType)) {
                TypedValue array = TypedValue.ArrayValue.single(single);
                if (attempts.tryWrite(array) == null) {
                    return array;
                }
            }
        }

        if (first instanceof TypedValue.DoubleValue) {
            TypedValue asFloat = convertQuietly(literal, BuiltinType.FLOAT);
            if (asFloat != null && attempts.tryWrite(asFloat) == null) {
                return asFloat;
            }
        }

        for (BuiltinType candidate : FALLBACK_CANDIDATES) {
            TypedValue scalar = convertQuietly(literal, candidate);
            if (scalar == null) {
                continue;
            }
            if (attempts.tryWrite(scalar) == null) {
                return scalar;
            }
            TypedValue array = TypedValue.ArrayValue.single(scalar);
            if (attempts.tryWrite(array) == null) {
                return array;
            }
        }
        return null;
    }

    private static TypedValue convertQuietly(String literal, BuiltinType type) {
        if (type == null) {
            return null;
        }
        try {
            return TypedValueParser.parseScalar(literal, type);
        } catch (ValueConversionException e) {
            log.debug("Fallback conversion to {} rejected: {}", type.displayName(), e.getMessage());
            return null;
        }
    }

    private static String stripBrackets(String literal) {
        String text = literal.trim();
        if (text.startsWith("[") && text.endsWith("]") && text.length() >= 2) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    private static final class Attempts {
        private final ProtocolSession session;
        private final String nodeId;
        private int count;

        private Attempts(ProtocolSession session, String nodeId) {
            this.session = session;
            this.nodeId = nodeId;
        }

        // Null on success.
        private ProtocolException tryWrite(TypedValue value) {
            count++;
            try {
                session.write(nodeId, value, WRITE_TIMEOUT);
            } catch (ProtocolException e) {
                log.debug("Write attempt {} to {} as {}{} failed: {}", count, nodeId,
                        value.type().displayName(), value.isArray() ? "[]" : "", e.getMessage());
                return e;
            }
            verify(value);
            return null;
        }

        private void verify(TypedValue value) {
            try {
                List<AttributeValue> results = session.readAttributes(nodeId,
                        List.of(AttributeId.VALUE, AttributeId.DATA_TYPE), VERIFY_TIMEOUT);
                Object serverValue = results.isEmpty() || results.get(0) == null ? null : results.get(0).value();
                Object serverType = results.size() < 2 || results.get(1) == null ? null : results.get(1).value();
                log.info("Write success. Server Value={} DataType={} (sent {})", serverValue,
                        serverType == null ? "" : BuiltinType.displayNameOf(String.valueOf(serverType)),
                        value.type().displayName());
            } catch (ProtocolException e) {
                log.info("Write success for {}; read-back failed: {}", nodeId, e.getMessage());
            }
        }
    }
}
