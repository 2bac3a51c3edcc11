package org.cbj.peerlink.transport.platform;

import org.cbj.peerlink.transport.TransportConfig;

public interface PeerPlatform {

    /**
     * Allocates a transport object. Implementations throw when the platform rejects the configuration.
     */
    PlatformConnection createConnection(TransportConfig config, PlatformConnection.Observer observer) throws Exception;

    void shutdown();
}
