package org.cbj.peerlink.transport;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TransportStatistics {
    public static final TransportStatistics EMPTY = TransportStatistics.builder().build();

    long bytesSent;
    long bytesReceived;
    long packetsSent;
    long packetsReceived;
    long packetsLost;
    double roundTripTimeMs;
    long connectionDurationMs;
    boolean relayed;
}
