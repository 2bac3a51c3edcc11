package org.cbj.peerlink.transport.platform;

public enum PlatformConnectionState {
    NEW,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    FAILED,
    CLOSED
}
