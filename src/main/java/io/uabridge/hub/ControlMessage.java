package io.uabridge.hub;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.uabridge.util.Jsons;

import java.util.List;
import java.util.Locale;

/**
 * Inbound client message: {@code {"action":"subscribe","node_ids":[...]}} and friends.
 */
public record ControlMessage(
        @JsonProperty("action") String action,
        @JsonProperty("node_ids") List<String> nodeIds
) {
    public enum Action {
        SUBSCRIBE,
        UNSUBSCRIBE,
        SUBSCRIBE_ALL,
        UNSUBSCRIBE_ALL;

        public static Action fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("action is required");
            }
            try {
                return Action.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown action: " + raw, e);
            }
        }
    }

    public ControlMessage {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }

    public static ControlMessage parse(String json) {
        return Jsons.fromJson(json, ControlMessage.class);
    }

    public Action parsedAction() {
        return Action.fromString(action);
    }
}
