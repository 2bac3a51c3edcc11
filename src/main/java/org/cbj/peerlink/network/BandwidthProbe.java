package org.cbj.peerlink.network;

import lombok.Value;

@FunctionalInterface
public interface BandwidthProbe {

    ProbeResult probe() throws Exception;

    @Value
    class ProbeResult {
        double downloadBps;
        double uploadBps;
        double latencyMs;
    }
}
