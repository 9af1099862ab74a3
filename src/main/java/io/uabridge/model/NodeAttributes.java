package io.uabridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display-ready attributes of a single node.
 *
 * @param valueRank -1 for scalars, 0 or more for arrays
 */
public record NodeAttributes(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("node_class") String nodeClass,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("access_level") String accessLevel,
        @JsonProperty("value") String value,
        @JsonProperty("value_rank") int valueRank
) {
    public boolean writable() {
        return accessLevel != null && accessLevel.contains("Write");
    }

    @JsonIgnore
    public boolean isArray() {
        return valueRank >= 0;
    }
}
