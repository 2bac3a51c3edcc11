package org.cbj.peerlink.network.dto;

import lombok.Value;

@Value
public class BandwidthAverage {
    public static final BandwidthAverage NONE = new BandwidthAverage(0, 0, 0);

    double download;
    double upload;
    double latency;
}
