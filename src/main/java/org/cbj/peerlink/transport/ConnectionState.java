package org.cbj.peerlink.transport;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a peer connection.
 * <pre>
 * CONNECTING -> CONNECTED -> RECONNECTING -> CONNECTED | FAILED
 * CONNECTING -> FAILED
 * any non-closed state -> CLOSED (terminal)
 * </pre>
 */
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FAILED,
    CLOSED;

    public Set<ConnectionState> successors() {
        switch (this) {
            case CONNECTING:
                return EnumSet.of(CONNECTED, FAILED, CLOSED);
            case CONNECTED:
                return EnumSet.of(RECONNECTING, CLOSED);
            case RECONNECTING:
                return EnumSet.of(CONNECTED, FAILED, CLOSED);
            case FAILED:
                return EnumSet.of(CLOSED);
            default:
                return EnumSet.noneOf(ConnectionState.class);
        }
    }

    public boolean canTransitionTo(ConnectionState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
