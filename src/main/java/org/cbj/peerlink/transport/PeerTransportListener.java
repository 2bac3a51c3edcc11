package org.cbj.peerlink.transport;

public interface PeerTransportListener {

    default void onStateChanged(String connectionId, ConnectionState state) {
    }

    default void onLocalCandidate(String connectionId, IceCandidate candidate) {
    }

    default void onIceFailed(String connectionId) {
    }

    default void onChannelOpened(String connectionId, String label) {
    }

    default void onChannelClosed(String connectionId, String label) {
    }

    default void onChannelMessage(String connectionId, String label, byte[] data) {
    }

    default void onChannelError(String connectionId, String label, Throwable error) {
    }
}
