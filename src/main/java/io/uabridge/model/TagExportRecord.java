package io.uabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"node_id", "name", "data_type", "description", "path"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TagExportRecord(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("name") String name,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("description") String description,
        @JsonProperty("path") String path
) {
}
