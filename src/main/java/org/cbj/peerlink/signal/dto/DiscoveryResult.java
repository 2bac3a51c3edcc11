package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class DiscoveryResult {
    private String deviceId;
    private DeviceInfo deviceInfo;
    private SignalEstimate signal;
    private Instant discovered;
}
