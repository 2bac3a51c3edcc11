package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class DiscoveryReply {
    private String discoveryId;
    private DeviceInfo deviceInfo;
    private SignalEstimate signal;
}
