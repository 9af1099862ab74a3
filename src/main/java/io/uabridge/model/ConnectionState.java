package io.uabridge.model;

public enum ConnectionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    DISCONNECTING
}
