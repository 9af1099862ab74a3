package io.uabridge.write;

import io.uabridge.protocol.TypedValue;

/**
 * Result of one write request. {@code value} is the payload that the server accepted, or null.
 */
public record WriteOutcome(String nodeId, boolean success, TypedValue value, int attempts, String error) {
    public static WriteOutcome succeeded(String nodeId, TypedValue value, int attempts) {
        return new WriteOutcome(nodeId, true, value, attempts, "");
    }

    public static WriteOutcome failed(String nodeId, int attempts, String error) {
        return new WriteOutcome(nodeId, false, null, attempts, error == null ? "" : error);
    }
}
