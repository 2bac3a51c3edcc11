package org.cbj.peerlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.connection.ConnectionManager;
import org.cbj.peerlink.error.PeerLinkException;
import org.cbj.peerlink.network.BandwidthProbe;
import org.cbj.peerlink.network.HttpBandwidthProbe;
import org.cbj.peerlink.network.NetworkMediumDetector;
import org.cbj.peerlink.network.NetworkOptimizer;
import org.cbj.peerlink.network.SimulatedBandwidthProbe;
import org.cbj.peerlink.signal.client.SignalingClient;
import org.cbj.peerlink.signal.client.SignalingTransport;
import org.cbj.peerlink.signal.client.StompSignalingTransport;
import org.cbj.peerlink.transport.PeerTransportManager;
import org.cbj.peerlink.transport.platform.webrtc.WebRtcPeerPlatform;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.Random;
import java.util.UUID;

@Configuration
@EnableConfigurationProperties(PeerLinkProperties.class)
@Slf4j
public class PeerLinkConfig {

    @Bean(destroyMethod = "")
    public PeerTransportManager peerTransportManager(PeerLinkProperties properties) {
        TransportProperties transport = properties.getTransport();
        return new PeerTransportManager(new WebRtcPeerPlatform(), transport.toTransportConfig(),
                transport.getStatsInterval());
    }

    @Bean
    public SignalingTransport signalingTransport(PeerLinkProperties properties, ObjectMapper objectMapper) {
        return new StompSignalingTransport(properties.getSignaling().getServerUrl(), objectMapper);
    }

    @Bean(destroyMethod = "")
    public SignalingClient signalingClient(PeerLinkProperties properties, SignalingTransport signalingTransport,
                                           ObjectMapper objectMapper) {
        return new SignalingClient(resolveDeviceId(properties), properties.getDevice(), properties.getSignaling(),
                signalingTransport, objectMapper);
    }

    @Bean
    public BandwidthProbe bandwidthProbe(PeerLinkProperties properties, RestTemplateBuilder restTemplateBuilder) {
        OptimizerProperties optimizer = properties.getOptimizer();
        if (!StringUtils.hasText(optimizer.getProbeUrl())) {
            log.info("### no probe url configured, using simulated bandwidth probe");
            return new SimulatedBandwidthProbe(new Random());
        }
        return new HttpBandwidthProbe(restTemplateBuilder.build(), optimizer.getProbeUrl(),
                optimizer.getProbePayloadBytes());
    }

    @Bean(destroyMethod = "")
    public NetworkOptimizer networkOptimizer(PeerLinkProperties properties, BandwidthProbe bandwidthProbe) {
        return new NetworkOptimizer(properties.getOptimizer(), bandwidthProbe, new NetworkMediumDetector(), new Random());
    }

    @Bean(destroyMethod = "destroy")
    public ConnectionManager connectionManager(PeerTransportManager peerTransportManager,
                                               SignalingClient signalingClient,
                                               NetworkOptimizer networkOptimizer,
                                               PeerLinkProperties properties) {
        return new ConnectionManager(peerTransportManager, signalingClient, networkOptimizer,
                properties.getConnection());
    }

    @Bean
    public ApplicationRunner peerLinkStartup(ConnectionManager connectionManager, SignalingClient signalingClient,
                                             PeerLinkProperties properties) {
        return args -> {
            connectionManager.start();
            if (!properties.getSignaling().isConnectOnStartup()) {
                return;
            }
            signalingClient.connect().whenComplete((ignored, error) -> {
                if (error != null) {
                    PeerLinkException cause = PeerLinkException.unwrap(error);
                    log.warn("### signaling not reachable at startup: {}",
                            cause != null ? cause.getCode() : error.getMessage());
                } else {
                    log.info("### device {} online", signalingClient.getDeviceId());
                }
            });
        };
    }

    static String resolveDeviceId(PeerLinkProperties properties) {
        if (StringUtils.hasText(properties.getDeviceId())) {
            return properties.getDeviceId();
        }
        String generated = "device-" + UUID.randomUUID();
        log.warn("### peerlink.device-id not set, using generated id {}", generated);
        return generated;
    }
}
