package io.uabridge.model;

public record StatusCodeInfo(
        String severity,
        String symbolicName,
        int subCode,
        boolean structureChanged,
        boolean semanticsChanged,
        int infoBits,
        String rawCode
) {
}
