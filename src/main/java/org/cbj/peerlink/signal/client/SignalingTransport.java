package org.cbj.peerlink.signal.client;

import org.cbj.peerlink.signal.dto.SignalMessage;

import java.util.concurrent.CompletableFuture;

public interface SignalingTransport {

    CompletableFuture<Void> connect(String deviceId, Handler handler);

    /**
     * @throws RuntimeException if the message could not be handed to the server
     */
    void send(SignalMessage message);

    boolean isConnected();

    /** Caller-initiated close. Does not report {@link Handler#onDisconnected}. */
    void disconnect();

    interface Handler {
        void onMessage(SignalMessage message);

        /** The connection was lost without {@link #disconnect()} being called. */
        void onDisconnected(String reason);
    }
}
