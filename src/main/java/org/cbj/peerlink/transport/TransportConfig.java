package org.cbj.peerlink.transport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class TransportConfig {

    @Singular
    List<IceServer> iceServers;
    @Builder.Default
    BundlePolicy bundlePolicy = BundlePolicy.MAX_BUNDLE;
    @Builder.Default
    IceTransportPolicy iceTransportPolicy = IceTransportPolicy.ALL;

    public static TransportConfig defaults() {
        return TransportConfig.builder()
                .iceServer(new IceServer(List.of("stun:stun.l.google.com:19302", "stun:stun1.l.google.com:19302"),
                        null, null))
                .build();
    }

    public enum BundlePolicy {
        BALANCED, MAX_BUNDLE, MAX_COMPAT
    }

    public enum IceTransportPolicy {
        ALL, RELAY
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IceServer {
        private List<String> urls = new ArrayList<>();
        private String username;
        private String credential;
    }
}
