package org.cbj.peerlink.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;

@Getter
@Setter
@ToString
public class OptimizerProperties {
    private Duration monitorInterval = Duration.ofSeconds(10);
    private int historyLength = 10;
    private double adaptationThreshold = 0.2;
    private String probeUrl;   // empty = simulated probe
    private int probePayloadBytes = 1024 * 1024;
}
