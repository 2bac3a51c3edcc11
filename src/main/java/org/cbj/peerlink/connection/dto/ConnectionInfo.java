package org.cbj.peerlink.connection.dto;

import lombok.Builder;
import lombok.Value;
import org.cbj.peerlink.transport.ConnectionState;
import org.cbj.peerlink.transport.TransportStatistics;

import java.time.Instant;

@Value
@Builder
public class ConnectionInfo {
    String id;
    String deviceId;
    ConnectionState state;
    ConnectionType type;
    ConnectionQuality quality;
    TransportStatistics statistics;
    Instant createdAt;
    Instant lastActivity;
    int reconnectAttempts;
    String failureReason;
}
