package io.uabridge.runtime;

import io.uabridge.protocol.LocalizedText;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Renders protocol values, access levels and watch timestamps as display strings.
 */
public final class ValueFormatter {
    private static final DateTimeFormatter VALUE_TIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.ROOT)
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter WATCH_TIME = DateTimeFormatter
            .ofPattern("HH:mm:ss.SSS", Locale.ROOT)
            .withZone(ZoneId.systemDefault());

    private static final int ACCESS_READ = 0x01;
    private static final int ACCESS_WRITE = 0x02;
    private static final int ACCESS_HISTORY_READ = 0x04;
    private static final int ACCESS_HISTORY_WRITE = 0x08;
    private static final int ACCESS_SEMANTIC_CHANGE = 0x10;
    private static final int ACCESS_STATUS_WRITE = 0x20;
    private static final int ACCESS_TIMESTAMP_WRITE = 0x40;

    private ValueFormatter() {
    }

    /**
     * Formats a plain protocol value. Byte strings are shown as text for String nodes, as
     * contiguous lowercase hex for ByteString nodes and as spaced uppercase hex otherwise.
     */
    public static String formatValue(Object value, String dataType) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof byte[] bytes) {
            if ("string".equalsIgnoreCase(dataType)) {
                return new String(bytes, StandardCharsets.UTF_8);
            }
            if ("bytestring".equalsIgnoreCase(dataType)) {
                return HexFormat.of().formatHex(bytes);
            }
            return HexFormat.ofDelimiter(" ").withUpperCase().formatHex(bytes);
        }
        if (value instanceof Instant instant) {
            return VALUE_TIME.format(instant);
        }
        if (value instanceof LocalizedText text) {
            return text.text() == null ? "" : text.text();
        }
        if (value instanceof List<?> list) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : list) {
                joiner.add(formatValue(element, dataType));
            }
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    public static String formatAccessLevel(int level) {
        List<String> parts = new ArrayList<>();
        if ((level & ACCESS_READ) != 0) {
            parts.add("Read");
        }
        if ((level & ACCESS_WRITE) != 0) {
            parts.add("Write");
        }
        if ((level & ACCESS_HISTORY_READ) != 0) {
            parts.add("HistoryRead");
        }
        if ((level & ACCESS_HISTORY_WRITE) != 0) {
            parts.add("HistoryWrite");
        }
        if ((level & ACCESS_SEMANTIC_CHANGE) != 0) {
            parts.add("SemanticChange");
        }
        if ((level & ACCESS_STATUS_WRITE) != 0) {
            parts.add("StatusWrite");
        }
        if ((level & ACCESS_TIMESTAMP_WRITE) != 0) {
            parts.add("TimestampWrite");
        }
        if (parts.isEmpty()) {
            return "None";
        }
        return String.join(", ", parts);
    }

    public static String watchTimestamp(Instant instant) {
        return WATCH_TIME.format(instant);
    }
}
