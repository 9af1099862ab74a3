package io.uabridge.hub;

import io.uabridge.model.WatchSnapshot;
import io.uabridge.runtime.BroadcastChannel;
import io.uabridge.runtime.SessionController;

import java.util.Optional;

/**
 * What the hub needs from the session runtime.
 */
public interface HubBackend {
    BroadcastChannel currentChannel();

    boolean isConnected();

    boolean addWatch(String nodeId);

    Optional<WatchSnapshot> currentSnapshot(String nodeId);

    static HubBackend of(SessionController controller) {
        return new HubBackend() {
            @Override
            public BroadcastChannel currentChannel() {
                return controller.currentBroadcastChannel();
            }

            @Override
            public boolean isConnected() {
                return controller.isConnected();
            }

            @Override
            public boolean addWatch(String nodeId) {
                return controller.addWatch(nodeId);
            }

            @Override
            public Optional<WatchSnapshot> currentSnapshot(String nodeId) {
                return controller.currentSnapshot(nodeId);
            }
        };
    }
}
