package org.cbj.peerlink.signal.client;

import org.cbj.peerlink.signal.dto.CandidatePayload;
import org.cbj.peerlink.signal.dto.ConnectionRequest;
import org.cbj.peerlink.signal.dto.DiscoveryResult;
import org.cbj.peerlink.signal.dto.SignalMessage;
import org.cbj.peerlink.transport.SessionDescription;

public interface SignalingListener {

    default void onConnected() {
    }

    default void onDisconnected(String reason) {
    }

    default void onReconnected() {
    }

    /** Automatic reconnection gave up. No further attempts are made until {@code connect()} is called. */
    default void onReconnectFailed() {
    }

    default void onMessageReceived(SignalMessage message) {
    }

    default void onOffer(String from, SessionDescription offer) {
    }

    default void onAnswer(String from, SessionDescription answer) {
    }

    default void onIceCandidate(String from, CandidatePayload payload) {
    }

    default void onConnectionRequest(ConnectionRequest request) {
    }

    default void onConnectionClose(String from, String reason) {
    }

    default void onDeviceDiscovered(DiscoveryResult result) {
    }

    default void onSignalingError(String from, Object error) {
    }
}
