package io.uabridge.model;

import io.uabridge.protocol.NodeClass;

public record AddressSpaceNode(String nodeId, String name, NodeClass nodeClass, boolean hasChildren) {
    public AddressSpaceNode withHasChildren(boolean value) {
        return new AddressSpaceNode(nodeId, name, nodeClass, value);
    }
}
