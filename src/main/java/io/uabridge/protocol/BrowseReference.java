package io.uabridge.protocol;

/**
 * A forward hierarchical reference returned by a browse call.
 *
 * @param nodeId concrete node id, or null when the target lives on another server
 * @param expandedNodeId expanded form of the target id, may be null
 */
public record BrowseReference(String nodeId, String expandedNodeId, String displayName, NodeClass nodeClass) {
}
