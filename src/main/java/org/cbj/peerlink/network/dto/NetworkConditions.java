package org.cbj.peerlink.network.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class NetworkConditions {
    double bandwidth;
    double latency;
    double packetLoss;
    double jitter;
    @Builder.Default
    NetworkMedium medium = NetworkMedium.UNKNOWN;
    @Builder.Default
    boolean stable = true;
}
