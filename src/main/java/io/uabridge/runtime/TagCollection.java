package io.uabridge.runtime;

import io.uabridge.model.TagExportRecord;

import java.util.List;

/**
 * Result of a variable traversal. {@code error} is set when the walk stopped early; the tags
 * collected up to that point are still returned.
 */
public record TagCollection(List<TagExportRecord> tags, String error) {
    public static final String TIMEOUT_ERROR = "export traversal timeout";

    public TagCollection {
        tags = List.copyOf(tags);
    }

    public boolean complete() {
        return error == null;
    }
}
