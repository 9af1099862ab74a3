package io.uabridge.protocol;

import java.util.Locale;

public enum SecurityMode {
    NONE("None"),
    SIGN("Sign"),
    SIGN_AND_ENCRYPT("SignAndEncrypt");

    private final String displayName;

    SecurityMode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static SecurityMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String normalized = raw.trim().replace("_", "").toLowerCase(Locale.ROOT);
        for (SecurityMode value : values()) {
            if (value.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown security mode: " + raw);
    }
}
