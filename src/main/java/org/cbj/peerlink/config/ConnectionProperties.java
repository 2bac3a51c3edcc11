package org.cbj.peerlink.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.cbj.peerlink.transport.ChannelSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
public class ConnectionProperties {
    private int maxReconnectAttempts = 3;
    private Duration reconnectDelay = Duration.ofSeconds(2);   // multiplied by the attempt number
    private Duration connectionTimeout = Duration.ofSeconds(30);
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration heartbeatTimeout = Duration.ofSeconds(60);
    private Duration closeGrace = Duration.ofSeconds(1);
    private List<ChannelSpec> channels = new ArrayList<>(List.of(ChannelSpec.ordered("control")));
}
