package io.uabridge.protocol;

import java.time.Instant;

/**
 * One attribute read result in protocol-neutral form.
 *
 * <p>{@code value} holds plain Java types: Boolean, Byte (SByte), Short (Byte, Int16),
 * Integer (UInt16, Int32), Long (UInt32, Int64), BigInteger (UInt64), Float, Double, String,
 * Instant (DateTime), byte[] (ByteString), {@link LocalizedText}, node ids as String, and
 * {@code java.util.List} for arrays. {@code type} is the builtin type of the carried value,
 * or null when the server returned nothing.
 */
public record AttributeValue(Object value, BuiltinType type, long statusCode, Instant sourceTime) {
    public static final long GOOD = 0L;

    public static AttributeValue of(Object value, BuiltinType type) {
        return new AttributeValue(value, type, GOOD, null);
    }

    public static AttributeValue bad(long statusCode) {
        return new AttributeValue(null, null, statusCode, null);
    }

    public boolean isGood() {
        return (statusCode >>> 30) == 0L;
    }

    public boolean hasValue() {
        return value != null;
    }
}
