package org.cbj.peerlink.network.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class BandwidthMeasurement {
    double download;    // bps
    double upload;      // bps
    double latency;     // ms
    double jitter;      // ms
    Instant timestamp;
    long durationMs;
}
