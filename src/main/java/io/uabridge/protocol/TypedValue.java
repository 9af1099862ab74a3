package io.uabridge.protocol;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * A write payload in its exact wire shape. Parsing decides the variant once; the transport
 * adapter pattern-matches on it.
 */
public sealed interface TypedValue {
    BigInteger UINT64_MAX = new BigInteger("18446744073709551615");

    BuiltinType type();

    /**
     * Plain Java form, matching what {@link AttributeValue#value()} carries for the same type.
     */
    Object plain();

    default boolean isArray() {
        return false;
    }

    record BooleanValue(boolean value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.BOOLEAN;
        }

        public Object plain() {
            return value;
        }
    }

    record SByteValue(byte value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.SBYTE;
        }

        public Object plain() {
            return value;
        }
    }

    record ByteValue(short value) implements TypedValue {
        public ByteValue {
            checkRange(value, 0, 0xFF, "Byte");
        }

        public BuiltinType type() {
            return BuiltinType.BYTE;
        }

        public Object plain() {
            return value;
        }
    }

    record Int16Value(short value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.INT16;
        }

        public Object plain() {
            return value;
        }
    }

    record UInt16Value(int value) implements TypedValue {
        public UInt16Value {
            checkRange(value, 0, 0xFFFF, "UInt16");
        }

        public BuiltinType type() {
            return BuiltinType.UINT16;
        }

        public Object plain() {
            return value;
        }
    }

    record Int32Value(int value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.INT32;
        }

        public Object plain() {
            return value;
        }
    }

    record UInt32Value(long value) implements TypedValue {
        public UInt32Value {
            checkRange(value, 0, 0xFFFF_FFFFL, "UInt32");
        }

        public BuiltinType type() {
            return BuiltinType.UINT32;
        }

        public Object plain() {
            return value;
        }
    }

    record Int64Value(long value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.INT64;
        }

        public Object plain() {
            return value;
        }
    }

    record UInt64Value(BigInteger value) implements TypedValue {
        public UInt64Value {
            if (value == null || value.signum() < 0 || value.compareTo(UINT64_MAX) > 0) {
                throw new IllegalArgumentException("UInt64 out of range: " + value);
            }
        }

        public BuiltinType type() {
            return BuiltinType.UINT64;
        }

        public Object plain() {
            return value;
        }
    }

    record FloatValue(float value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.FLOAT;
        }

        public Object plain() {
            return value;
        }
    }

    record DoubleValue(double value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.DOUBLE;
        }

        public Object plain() {
            return value;
        }
    }

    record StringValue(String value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.STRING;
        }

        public Object plain() {
            return value;
        }
    }

    record DateTimeValue(Instant value) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.DATE_TIME;
        }

        public Object plain() {
            return value;
        }
    }

    record ByteStringValue(byte[] value) implements TypedValue {
        public ByteStringValue {
            value = value == null ? new byte[0] : value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public BuiltinType type() {
            return BuiltinType.BYTE_STRING;
        }

        public Object plain() {
            return value.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof ByteStringValue that && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "ByteStringValue[" + HexFormat.of().formatHex(value) + "]";
        }
    }

    record LocalizedTextValue(String locale, String text) implements TypedValue {
        public BuiltinType type() {
            return BuiltinType.LOCALIZED_TEXT;
        }

        public Object plain() {
            return new LocalizedText(locale, text);
        }
    }

    record ArrayValue(BuiltinType elementType, List<TypedValue> elements) implements TypedValue {
        public ArrayValue {
            elements = List.copyOf(elements);
            for (TypedValue element : elements) {
                if (element.isArray() || element.type() != elementType) {
                    throw new IllegalArgumentException(
                            "array element " + element + " does not match element type " + elementType.displayName());
                }
            }
        }

        public static ArrayValue single(TypedValue element) {
            return new ArrayValue(element.type(), List.of(element));
        }

        public BuiltinType type() {
            return elementType;
        }

        public Object plain() {
            List<Object> out = new ArrayList<>(elements.size());
            for (TypedValue element : elements) {
                out.add(element.plain());
            }
            return out;
        }

        @Override
        public boolean isArray() {
            return true;
        }
    }

    private static void checkRange(long value, long min, long max, String typeName) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(typeName + " out of range: " + value);
        }
    }
}
