package io.uabridge.write;

import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.TypedValue;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Converts caller literals into {@link TypedValue}s of an exact builtin type.
 */
public final class TypedValueParser {
    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter SPACED_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.ROOT);

    private TypedValueParser() {
    }

    public static TypedValue parseScalar(String literal, String typeName) throws ValueConversionException {
        BuiltinType type = BuiltinType.fromName(typeName);
        if (type == null) {
            throw new ValueConversionException("unsupported data type: " + typeName);
        }
        return parseScalar(literal, type);
    }

    public static TypedValue parseScalar(String literal, BuiltinType type) throws ValueConversionException {
        String raw = literal == null ? "" : literal;
        String text = raw.trim();
        try {
            return switch (type) {
                case BOOLEAN -> new TypedValue.BooleanValue(parseBoolean(text));
                case SBYTE -> new TypedValue.SByteValue(Byte.parseByte(text));
                case BYTE -> new TypedValue.ByteValue((short) parseUnsigned(text, 0xFFL, type));
                case INT16 -> new TypedValue.Int16Value(Short.parseShort(text));
                case UINT16 -> new TypedValue.UInt16Value((int) parseUnsigned(text, 0xFFFFL, type));
                case INT32 -> new TypedValue.Int32Value(Integer.parseInt(text));
                case UINT32 -> new TypedValue.UInt32Value(parseUnsigned(text, 0xFFFF_FFFFL, type));
                case INT64 -> new TypedValue.Int64Value(Long.parseLong(text));
                case UINT64 -> new TypedValue.UInt64Value(parseUInt64(text));
                case FLOAT -> new TypedValue.FloatValue(parseFloat(text));
                case DOUBLE -> new TypedValue.DoubleValue(parseDouble(text));
                case STRING -> new TypedValue.StringValue(raw);
                case DATE_TIME -> new TypedValue.DateTimeValue(parseDateTime(text));
                case BYTE_STRING -> new TypedValue.ByteStringValue(parseByteString(raw));
                case LOCALIZED_TEXT -> parseLocalizedText(raw);
                default -> throw new ValueConversionException("unsupported data type: " + type.displayName());
            };
        } catch (NumberFormatException e) {
            throw new ValueConversionException(
                    "cannot parse '" + text + "' as " + type.displayName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses {@code [a, b, c]} or {@code a, b, c} into an array of {@code elementType}.
     * Blank items are skipped; an empty list is rejected.
     */
    public static TypedValue.ArrayValue parseArray(String literal, BuiltinType elementType) throws ValueConversionException {
        if (!isArrayElementType(elementType)) {
            throw new ValueConversionException("array writes for type '"
                    + (elementType == null ? "unknown" : elementType.displayName()) + "' are not supported");
        }
        List<String> items = splitArrayLiteral(literal);
        if (items.isEmpty()) {
            throw new ValueConversionException("empty array input for array-typed node");
        }
        List<TypedValue> elements = new ArrayList<>(items.size());
        for (String item : items) {
            elements.add(parseScalar(item, elementType));
        }
        return new TypedValue.ArrayValue(elementType, elements);
    }

    public static boolean isArrayElementType(BuiltinType type) {
        if (type == null) {
            return false;
        }
        return switch (type) {
            case FLOAT, DOUBLE, INT16, UINT16, INT32, UINT32, INT64, UINT64,
                    BOOLEAN, STRING, LOCALIZED_TEXT, DATE_TIME -> true;
            default -> false;
        };
    }

    static List<String> splitArrayLiteral(String literal) {
        String text = literal == null ? "" : literal.trim();
        if (text.startsWith("[")) {
            text = text.substring(1);
        }
        if (text.endsWith("]")) {
            text = text.substring(0, text.length() - 1);
        }
        List<String> out = new ArrayList<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                out.add(item);
            }
        }
        return out;
    }

    /**
     * Byte-string literals: {@code ascii:}/{@code text:} give raw bytes, {@code hex:} is optional,
     * and hex digits may be separated by space, comma, semicolon or colon with optional
     * {@code 0x} prefixes. Anything that is not even-length hex falls back to the raw bytes.
     */
    public static byte[] parseByteString(String literal) {
        String original = literal == null ? "" : literal;
        String text = original.trim();
        if (text.isEmpty()) {
            return new byte[0];
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("ascii:") || lower.startsWith("text:")) {
            return text.substring(text.indexOf(':') + 1).trim().getBytes(StandardCharsets.UTF_8);
        }
        if (lower.startsWith("hex:")) {
            text = text.substring(4).trim();
        }
        StringBuilder digits = new StringBuilder(text.length());
        for (String part : text.split("[ ,;:]+")) {
            if (part.isEmpty()) {
                continue;
            }
            String token = part;
            if (token.startsWith("0x") || token.startsWith("0X")) {
                token = token.substring(2);
            }
            digits.append(token);
        }
        String hex = digits.toString();
        if (hex.length() % 2 == 0) {
            try {
                return HexFormat.of().parseHex(hex);
            } catch (IllegalArgumentException e) {
                return original.getBytes(StandardCharsets.UTF_8);
            }
        }
        return original.getBytes(StandardCharsets.UTF_8);
    }

    static boolean parseBoolean(String text) throws ValueConversionException {
        switch (text) {
            case "1", "t", "T", "true", "TRUE", "True":
                return true;
            case "0", "f", "F", "false", "FALSE", "False":
                return false;
            default:
                throw new ValueConversionException("cannot parse '" + text + "' as Boolean");
        }
    }

    static Instant parseDateTime(String text) throws ValueConversionException {
        if ("now".equalsIgnoreCase(text)) {
            return Instant.now();
        }
        DateTimeParseException failure;
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            failure = e;
        }
        for (DateTimeFormatter formatter : List.of(SPACED, SPACED_MILLIS)) {
            try {
                return LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new ValueConversionException("cannot parse '" + text + "' as DateTime", failure);
    }

    static TypedValue.LocalizedTextValue parseLocalizedText(String raw) {
        int split = raw.indexOf('|');
        if (split >= 0) {
            return new TypedValue.LocalizedTextValue(raw.substring(0, split).trim(), raw.substring(split + 1).trim());
        }
        return new TypedValue.LocalizedTextValue("", raw);
    }

    private static long parseUnsigned(String text, long max, BuiltinType type) throws ValueConversionException {
        long value = Long.parseLong(text);
        if (value < 0 || value > max) {
            throw new ValueConversionException("value " + text + " out of range for " + type.displayName());
        }
        return value;
    }

    private static BigInteger parseUInt64(String text) throws ValueConversionException {
        BigInteger value = new BigInteger(text);
        if (value.signum() < 0 || value.compareTo(TypedValue.UINT64_MAX) > 0) {
            throw new ValueConversionException("value " + text + " out of range for UInt64");
        }
        return value;
    }

    private static float parseFloat(String text) throws ValueConversionException {
        float value = Float.parseFloat(text);
        if (Float.isInfinite(value) && !isExplicitInfinity(text)) {
            throw new ValueConversionException("value " + text + " out of range for Float");
        }
        return value;
    }

    private static double parseDouble(String text) throws ValueConversionException {
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value) && !isExplicitInfinity(text)) {
            throw new ValueConversionException("value " + text + " out of range for Double");
        }
        return value;
    }

    private static boolean isExplicitInfinity(String text) {
        return text.toLowerCase(Locale.ROOT).contains("inf");
    }
}
