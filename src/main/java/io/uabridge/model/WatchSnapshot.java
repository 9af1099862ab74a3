package io.uabridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable copy of a watch entry's public fields. Handed to state observers and to the hub;
 * never shared with the mutable entry it was copied from.
 */
public record WatchSnapshot(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("name") String name,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("value") String value,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("severity") String severity,
        @JsonProperty("symbolic_name") String symbolicName,
        @JsonProperty("sub_code") int subCode,
        @JsonProperty("structure_changed") boolean structureChanged,
        @JsonProperty("semantics_changed") boolean semanticsChanged,
        @JsonProperty("info_bits") int infoBits,
        @JsonProperty("raw_code") String rawCode
) {
}
