package org.cbj.peerlink.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.cbj.peerlink.signal.dto.DeviceInfo;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ToString
@ConfigurationProperties("peerlink")
public class PeerLinkProperties {
    private String deviceId;
    private DeviceInfo device = new DeviceInfo();
    private SignalingProperties signaling = new SignalingProperties();
    private ConnectionProperties connection = new ConnectionProperties();
    private TransportProperties transport = new TransportProperties();
    private OptimizerProperties optimizer = new OptimizerProperties();
    private Relay relay = new Relay();

    @Getter
    @Setter
    @ToString
    public static class Relay {
        private boolean enabled = false;
    }
}
