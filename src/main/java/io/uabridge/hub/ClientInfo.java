package io.uabridge.hub;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ClientInfo(
        @JsonProperty("remote_addr") String remoteAddress,
        @JsonProperty("subscriptions") List<String> subscriptions
) {
}
