package io.uabridge.runtime;

import io.uabridge.model.NodeAttributes;
import io.uabridge.model.WatchSnapshot;

import java.util.List;

/**
 * Observer of controller state. Callbacks run on controller or generation threads and must not
 * block; the default implementations ignore the event.
 */
public interface ControllerListener {
    /**
     * @param error the last connect error, or null on success and on disconnect
     */
    default void onConnectionStateChange(boolean connected, String endpointUrl, Exception error) {
    }

    // Sorted by node id.
    default void onWatchListUpdate(List<WatchSnapshot> watches) {
    }

    default void onNodeAttributesUpdate(NodeAttributes attributes) {
    }

    default void onAddressSpaceReset() {
    }

    default void onAddressSpaceChanged(String parentId) {
    }
}
