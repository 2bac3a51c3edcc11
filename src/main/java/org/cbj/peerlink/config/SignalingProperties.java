package org.cbj.peerlink.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;

@Getter
@Setter
@ToString
public class SignalingProperties {
    private String serverUrl = "http://localhost:8080/ws";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private int maxReconnectAttempts = 5;
    private Duration reconnectDelay = Duration.ofSeconds(2);   // base of the exponential backoff
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private boolean connectOnStartup = true;
}
