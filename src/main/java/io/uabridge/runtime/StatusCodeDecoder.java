package io.uabridge.runtime;

import io.uabridge.model.StatusCodeInfo;
import org.eclipse.milo.opcua.stack.core.StatusCodes;

import java.util.Locale;

/**
 * Splits a 32-bit status code into severity, sub-code, flags and info bits. Symbolic names come
 * from the status-code table shipped with the Milo stack.
 */
public final class StatusCodeDecoder {
    private StatusCodeDecoder() {
    }

    public static StatusCodeInfo decode(long statusCode) {
        long raw = statusCode & 0xFFFF_FFFFL;
        String severity = switch ((int) ((raw >>> 30) & 0x3)) {
            case 0 -> "Good";
            case 1 -> "Uncertain";
            case 2 -> "Bad";
            default -> "Unknown";
        };
        int subCode = (int) ((raw >>> 16) & 0x3FFF);
        boolean structureChanged = (raw & 0x8000L) != 0;
        boolean semanticsChanged = (raw & 0x4000L) != 0;
        int infoBits = (int) (raw & 0x3FFF);
        String rawCode = String.format(Locale.ROOT, "0x%08X", raw);
        return new StatusCodeInfo(severity, symbolicName(raw), subCode, structureChanged, semanticsChanged, infoBits, rawCode);
    }

    // Unknown codes resolve to their severity.
    public static String symbolicName(long statusCode) {
        long raw = statusCode & 0xFFFF_FFFFL;
        String name = StatusCodes.lookup(raw & 0xFFFF_0000L)
                .map(entry -> entry[0])
                .map(StatusCodeDecoder::compactName)
                .orElse(null);
        if (name != null && !name.isBlank()) {
            return name;
        }
        return switch ((int) ((raw >>> 30) & 0x3)) {
            case 0 -> "Good";
            case 1 -> "Uncertain";
            case 2 -> "Bad";
            default -> "Unknown";
        };
    }

    // The stack table spells names "Bad_NodeIdUnknown"; snapshots carry "BadNodeIdUnknown".
    private static String compactName(String name) {
        return name.replaceFirst("^(Good|Uncertain|Bad)_", "$1");
    }
}
