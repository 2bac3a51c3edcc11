package org.cbj.peerlink.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.cbj.peerlink.transport.TransportConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
public class TransportProperties {
    private List<TransportConfig.IceServer> iceServers = new ArrayList<>();
    private TransportConfig.BundlePolicy bundlePolicy = TransportConfig.BundlePolicy.MAX_BUNDLE;
    private TransportConfig.IceTransportPolicy iceTransportPolicy = TransportConfig.IceTransportPolicy.ALL;
    private Duration statsInterval = Duration.ofSeconds(5);

    public TransportConfig toTransportConfig() {
        if (iceServers.isEmpty()) {
            return TransportConfig.defaults().toBuilder()
                    .bundlePolicy(bundlePolicy)
                    .iceTransportPolicy(iceTransportPolicy)
                    .build();
        }
        return TransportConfig.builder()
                .iceServers(iceServers)
                .bundlePolicy(bundlePolicy)
                .iceTransportPolicy(iceTransportPolicy)
                .build();
    }
}
