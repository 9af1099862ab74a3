package io.uabridge.protocol;

@FunctionalInterface
public interface DataChangeListener {
    void onDataChange(String nodeId, AttributeValue value);
}
