package io.uabridge.protocol;

import java.util.Locale;

/**
 * Namespace-0 builtin data types, keyed by their numeric node id.
 */
public enum BuiltinType {
    BOOLEAN(1, "Boolean"),
    SBYTE(2, "SByte"),
    BYTE(3, "Byte"),
    INT16(4, "Int16"),
    UINT16(5, "UInt16"),
    INT32(6, "Int32"),
    UINT32(7, "UInt32"),
    INT64(8, "Int64"),
    UINT64(9, "UInt64"),
    FLOAT(10, "Float"),
    DOUBLE(11, "Double"),
    STRING(12, "String"),
    DATE_TIME(13, "DateTime"),
    GUID(14, "Guid"),
    BYTE_STRING(15, "ByteString"),
    XML_ELEMENT(16, "XmlElement"),
    NODE_ID(17, "NodeId"),
    EXPANDED_NODE_ID(18, "ExpandedNodeId"),
    STATUS_CODE(19, "StatusCode"),
    QUALIFIED_NAME(20, "QualifiedName"),
    LOCALIZED_TEXT(21, "LocalizedText"),
    EXTENSION_OBJECT(22, "ExtensionObject"),
    DATA_VALUE(23, "DataValue"),
    VARIANT(24, "Variant"),
    DIAGNOSTIC_INFO(25, "DiagnosticInfo");

    private final int id;
    private final String displayName;

    BuiltinType(int id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public int id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String nodeId() {
        return "i=" + id;
    }

    public static BuiltinType fromId(int id) {
        for (BuiltinType value : values()) {
            if (value.id == id) {
                return value;
            }
        }
        return null;
    }

    /**
     * Resolves a namespace-0 data type node id such as {@code i=6} or {@code ns=0;i=6}.
     * Returns null for other namespaces and for non-numeric identifiers.
     */
    public static BuiltinType fromNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return null;
        }
        String raw = nodeId.trim();
        if (raw.startsWith("ns=0;")) {
            raw = raw.substring("ns=0;".length());
        }
        if (!raw.startsWith("i=")) {
            return null;
        }
        try {
            return fromId(Integer.parseInt(raw.substring(2)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Resolves a type name as callers write it: the display name in any case, plus the
     * {@code float32}/{@code float64} aliases.
     */
    public static BuiltinType fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "bool":
                return BOOLEAN;
            case "float32":
                return FLOAT;
            case "float64":
                return DOUBLE;
            default:
                break;
        }
        for (BuiltinType value : values()) {
            if (value.displayName.toLowerCase(Locale.ROOT).equals(normalized)
                    || value.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Display name for a data type node id, falling back to the id itself outside namespace 0.
     */
    public static String displayNameOf(String dataTypeNodeId) {
        BuiltinType type = fromNodeId(dataTypeNodeId);
        if (type != null) {
            return type.displayName;
        }
        return dataTypeNodeId == null ? "" : dataTypeNodeId;
    }
}
