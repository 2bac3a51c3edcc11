package org.cbj.peerlink.connection;

import org.cbj.peerlink.connection.dto.ConnectionInfo;
import org.cbj.peerlink.connection.dto.ConnectionQuality;
import org.cbj.peerlink.signal.dto.ConnectionRequest;
import org.cbj.peerlink.signal.dto.DiscoveryResult;

import java.util.List;

public interface ConnectionEventListener {

    default void onInitialized() {
    }

    default void onIncoming(ConnectionRequest request) {
    }

    default void onStateChanged(ConnectionInfo connection) {
    }

    default void onEstablished(ConnectionInfo connection) {
    }

    default void onLost(ConnectionInfo connection) {
    }

    default void onReconnected(ConnectionInfo connection) {
    }

    /** Handshake failure or reconnection attempts exhausted. The record stays until closed or re-initiated. */
    default void onFailed(ConnectionInfo connection, Throwable cause) {
    }

    default void onClosed(ConnectionInfo connection, String reason) {
    }

    default void onQualityUpdated(String connectionId, ConnectionQuality quality) {
    }

    default void onDataReceived(String connectionId, String deviceId, String channel, byte[] data) {
    }

    default void onDevicesDiscovered(List<DiscoveryResult> devices) {
    }

    default void onSignalingReconnectFailed() {
    }
}
