package org.cbj.peerlink.connection.dto;

import lombok.Value;
import org.cbj.peerlink.network.dto.NetworkConditions;

@Value
public class ConnectionQuality {
    public static final ConnectionQuality UNKNOWN = new ConnectionQuality(0, 0, 0, 0, QualityRating.POOR);

    double latency;      // ms
    double bandwidth;    // bps
    double packetLoss;   // ratio
    double jitter;       // ms
    QualityRating rating;

    public static ConnectionQuality from(NetworkConditions conditions) {
        return new ConnectionQuality(conditions.getLatency(), conditions.getBandwidth(),
                conditions.getPacketLoss(), conditions.getJitter(), QualityRating.of(conditions));
    }
}
