package io.uabridge.protocol.milo;

import io.uabridge.protocol.AttributeValue;
import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.LocalizedText;
import io.uabridge.protocol.TypedValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.ByteString;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UByte;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.ULong;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ubyte;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ulong;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ushort;

/**
 * Conversions between Milo's builtin types and the protocol-neutral forms.
 */
final class MiloValues {
    private MiloValues() {
    }

    static AttributeValue toAttributeValue(DataValue dataValue) {
        if (dataValue == null) {
            return AttributeValue.bad(StatusCode.BAD.getValue());
        }
        long status = dataValue.getStatusCode() == null ? AttributeValue.GOOD : dataValue.getStatusCode().getValue();
        Object raw = dataValue.getValue() == null ? null : dataValue.getValue().getValue();
        DateTime source = dataValue.getSourceTime();
        Instant sourceTime = source == null ? null : Instant.ofEpochMilli(source.getJavaTime());
        return new AttributeValue(toPlain(raw), typeOf(raw), status, sourceTime);
    }

    /**
     * Maps a decoded Milo value to the plain Java form described on {@link AttributeValue}.
     */
    static Object toPlain(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Object[] items) {
            List<Object> out = new ArrayList<>(items.length);
            for (Object item : items) {
                out.add(toPlain(item));
            }
            return out;
        }
        if (raw instanceof UByte value) {
            return value.shortValue();
        }
        if (raw instanceof UShort value) {
            return value.intValue();
        }
        if (raw instanceof UInteger value) {
            return value.longValue();
        }
        if (raw instanceof ULong value) {
            return value.toBigInteger();
        }
        if (raw instanceof DateTime value) {
            return Instant.ofEpochMilli(value.getJavaTime());
        }
        if (raw instanceof ByteString value) {
            return value.bytesOrEmpty();
        }
        if (raw instanceof org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText value) {
            return new LocalizedText(value.getLocale(), value.getText());
        }
        if (raw instanceof NodeId value) {
            return value.toParseableString();
        }
        if (raw instanceof ExpandedNodeId value) {
            return value.toParseableString();
        }
        if (raw instanceof QualifiedName value) {
            return value.toParseableString();
        }
        if (raw instanceof StatusCode value) {
            return value.getValue();
        }
        if (raw instanceof UUID value) {
            return value.toString();
        }
        if (raw instanceof Boolean || raw instanceof Number || raw instanceof String) {
            return raw;
        }
        return raw.toString();
    }

    static BuiltinType typeOf(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw.getClass().isArray()) {
            return typeOfClass(raw.getClass().getComponentType());
        }
        return typeOfClass(raw.getClass());
    }

    private static BuiltinType typeOfClass(Class<?> type) {
        if (type == Boolean.class) {
            return BuiltinType.BOOLEAN;
        } else if (type == Byte.class) {
            return BuiltinType.SBYTE;
        } else if (type == UByte.class) {
            return BuiltinType.BYTE;
        } else if (type == Short.class) {
            return BuiltinType.INT16;
        } else if (type == UShort.class) {
            return BuiltinType.UINT16;
        } else if (type == Integer.class) {
            return BuiltinType.INT32;
        } else if (type == UInteger.class) {
            return BuiltinType.UINT32;
        } else if (type == Long.class) {
            return BuiltinType.INT64;
        } else if (type == ULong.class) {
            return BuiltinType.UINT64;
        } else if (type == Float.class) {
            return BuiltinType.FLOAT;
        } else if (type == Double.class) {
            return BuiltinType.DOUBLE;
        } else if (type == String.class) {
            return BuiltinType.STRING;
        } else if (type == DateTime.class) {
            return BuiltinType.DATE_TIME;
        } else if (type == UUID.class) {
            return BuiltinType.GUID;
        } else if (type == ByteString.class) {
            return BuiltinType.BYTE_STRING;
        } else if (type == NodeId.class) {
            return BuiltinType.NODE_ID;
        } else if (type == ExpandedNodeId.class) {
            return BuiltinType.EXPANDED_NODE_ID;
        } else if (type == StatusCode.class) {
            return BuiltinType.STATUS_CODE;
        } else if (type == QualifiedName.class) {
            return BuiltinType.QUALIFIED_NAME;
        } else if (type == org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText.class) {
            return BuiltinType.LOCALIZED_TEXT;
        }
        return null;
    }

    static Variant toVariant(TypedValue value) {
        return new Variant(toMilo(value));
    }

    private static Object toMilo(TypedValue value) {
        if (value instanceof TypedValue.ArrayValue array) {
            Object[] out = newMiloArray(array.elementType(), array.elements().size());
            for (int i = 0; i < out.length; i++) {
                out[i] = toMilo(array.elements().get(i));
            }
            return out;
        }
        if (value instanceof TypedValue.BooleanValue v) {
            return v.value();
        } else if (value instanceof TypedValue.SByteValue v) {
            return v.value();
        } else if (value instanceof TypedValue.ByteValue v) {
            return ubyte(v.value());
        } else if (value instanceof TypedValue.Int16Value v) {
            return v.value();
        } else if (value instanceof TypedValue.UInt16Value v) {
            return ushort(v.value());
        } else if (value instanceof TypedValue.Int32Value v) {
            return v.value();
        } else if (value instanceof TypedValue.UInt32Value v) {
            return uint(v.value());
        } else if (value instanceof TypedValue.Int64Value v) {
            return v.value();
        } else if (value instanceof TypedValue.UInt64Value v) {
            return ulong(v.value());
        } else if (value instanceof TypedValue.FloatValue v) {
            return v.value();
        } else if (value instanceof TypedValue.DoubleValue v) {
            return v.value();
        } else if (value instanceof TypedValue.StringValue v) {
            return v.value();
        } else if (value instanceof TypedValue.DateTimeValue v) {
            return new DateTime(Date.from(v.value()));
        } else if (value instanceof TypedValue.ByteStringValue v) {
            return ByteString.of(v.value());
        } else if (value instanceof TypedValue.LocalizedTextValue v) {
            String locale = v.locale() == null || v.locale().isBlank() ? null : v.locale();
            return new org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText(locale, v.text());
        }
        throw new IllegalArgumentException("unsupported write type: " + value.type().displayName());
    }

    // Variant infers the wire type from the array's component type.
    private static Object[] newMiloArray(BuiltinType type, int size) {
        return switch (type) {
            case BOOLEAN -> new Boolean[size];
            case SBYTE -> new Byte[size];
            case BYTE -> new UByte[size];
            case INT16 -> new Short[size];
            case UINT16 -> new UShort[size];
            case INT32 -> new Integer[size];
            case UINT32 -> new UInteger[size];
            case INT64 -> new Long[size];
            case UINT64 -> new ULong[size];
            case FLOAT -> new Float[size];
            case DOUBLE -> new Double[size];
            case STRING -> new String[size];
            case DATE_TIME -> new DateTime[size];
            case BYTE_STRING -> new ByteString[size];
            case LOCALIZED_TEXT -> new org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText[size];
            default -> throw new IllegalArgumentException("unsupported array element type: " + type.displayName());
        };
    }
}
