package org.cbj.peerlink.connection.dto;

import org.cbj.peerlink.network.dto.NetworkConditions;

public enum QualityRating {
    POOR,
    FAIR,
    GOOD,
    EXCELLENT;

    public static QualityRating of(NetworkConditions conditions) {
        double latency = conditions.getLatency();
        double loss = conditions.getPacketLoss();
        double bandwidth = conditions.getBandwidth();
        if (latency > 200 || loss > 0.05 || bandwidth < 1_000_000) {
            return POOR;
        }
        if (latency > 100 || loss > 0.02 || bandwidth < 5_000_000) {
            return FAIR;
        }
        if (latency > 50 || loss > 0.005 || bandwidth < 10_000_000) {
            return GOOD;
        }
        return EXCELLENT;
    }
}
