package org.cbj.peerlink.transport.platform;

import org.cbj.peerlink.transport.ChannelSpec;
import org.cbj.peerlink.transport.IceCandidate;
import org.cbj.peerlink.transport.SessionDescription;

import java.util.concurrent.CompletableFuture;

public interface PlatformConnection {

    /**
     * Callbacks arrive on platform threads.
     */
    interface Observer {
        void onStateChange(PlatformConnectionState state);

        void onIceCandidate(IceCandidate candidate);

        default void onIceFailed() {
        }

        default void onRemoteChannel(PlatformChannel channel) {
        }
    }

    /**
     * Creates an offer and commits it as the local description.
     */
    CompletableFuture<SessionDescription> createOffer();

    /**
     * Creates an answer and commits it as the local description.
     */
    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    void addIceCandidate(IceCandidate candidate) throws Exception;

    PlatformChannel createChannel(ChannelSpec spec) throws Exception;

    CompletableFuture<PlatformStats> getStats();

    void close();
}
