package org.cbj.peerlink.transport.platform;

import lombok.Builder;
import lombok.Value;

/**
 * One statistics report. Null fields were not reported by the platform.
 */
@Value
@Builder
public class PlatformStats {
    Long bytesSent;
    Long bytesReceived;
    Long packetsSent;
    Long packetsReceived;
    Long packetsLost;
    Double roundTripTimeMs;
    Boolean relayed;
}
