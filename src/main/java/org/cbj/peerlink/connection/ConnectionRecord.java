package org.cbj.peerlink.connection;

import lombok.AccessLevel;
import lombok.Getter;
import org.cbj.peerlink.config.ConnectionProperties;
import org.cbj.peerlink.connection.dto.ConnectionInfo;
import org.cbj.peerlink.connection.dto.ConnectionOptions;
import org.cbj.peerlink.connection.dto.ConnectionQuality;
import org.cbj.peerlink.connection.dto.ConnectionType;
import org.cbj.peerlink.transport.ChannelSpec;
import org.cbj.peerlink.transport.ConnectionState;
import org.cbj.peerlink.transport.IceCandidate;
import org.cbj.peerlink.transport.TransportStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

@Getter
public class ConnectionRecord {

    private final String id;
    private final String deviceId;
    private final ConnectionOptions options;
    private final Instant createdAt;

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile String transportId;
    private volatile String sessionId;      // requestId of the handshake that produced the transport
    private volatile ConnectionQuality quality = ConnectionQuality.UNKNOWN;
    private volatile Instant lastActivity;
    private volatile int reconnectAttempts;
    private volatile String failureReason;

    // control loop only
    @Getter(AccessLevel.NONE)
    boolean signalingReady;
    @Getter(AccessLevel.NONE)
    boolean awaitingAnswer;
    @Getter(AccessLevel.NONE)
    long lastBytesReceived;
    @Getter(AccessLevel.NONE)
    final List<IceCandidate> pendingLocalCandidates = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    ScheduledFuture<?> reconnectTimer;
    @Getter(AccessLevel.NONE)
    ScheduledFuture<?> establishWatchdog;

    ConnectionRecord(String id, String deviceId, ConnectionOptions options) {
        this.id = id;
        this.deviceId = deviceId;
        this.options = options != null ? options : ConnectionOptions.defaults();
        this.createdAt = Instant.now();
        this.lastActivity = createdAt;
    }

    /** Binds a fresh transport and handshake session. Candidates gathered so far belong to the old one. */
    void beginAttempt(String newTransportId, String newSessionId) {
        transportId = newTransportId;
        sessionId = newSessionId;
        signalingReady = false;
        awaitingAnswer = false;
        lastBytesReceived = 0;
        pendingLocalCandidates.clear();
        cancelWatchdog();
    }

    void detachTransport() {
        transportId = null;
        signalingReady = false;
        awaitingAnswer = false;
        pendingLocalCandidates.clear();
        cancelWatchdog();
    }

    boolean isTransport(String candidateTransportId) {
        return candidateTransportId != null && candidateTransportId.equals(transportId);
    }

    void setState(ConnectionState state) {
        this.state = state;
    }

    void setQuality(ConnectionQuality quality) {
        this.quality = quality;
    }

    void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    void touch() {
        lastActivity = Instant.now();
    }

    int nextReconnectAttempt() {
        return ++reconnectAttempts;
    }

    void resetReconnectAttempts() {
        reconnectAttempts = 0;
    }

    void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    void cancelWatchdog() {
        if (establishWatchdog != null) {
            establishWatchdog.cancel(false);
            establishWatchdog = null;
        }
    }

    int maxReconnectAttempts(ConnectionProperties defaults) {
        Integer max = options.getMaxReconnectAttempts();
        return max != null ? max : defaults.getMaxReconnectAttempts();
    }

    Duration reconnectDelay(ConnectionProperties defaults) {
        Duration delay = options.getReconnectDelay();
        return delay != null ? delay : defaults.getReconnectDelay();
    }

    Duration connectionTimeout(ConnectionProperties defaults) {
        Duration timeout = options.getTimeout();
        return timeout != null ? timeout : defaults.getConnectionTimeout();
    }

    List<ChannelSpec> channels(ConnectionProperties defaults) {
        List<ChannelSpec> channels = options.getChannels();
        return channels != null ? channels : defaults.getChannels();
    }

    ConnectionInfo snapshot(TransportStatistics statistics) {
        ConnectionType type = ConnectionType.UNKNOWN;
        if (state == ConnectionState.CONNECTED && statistics.getConnectionDurationMs() > 0) {
            type = statistics.isRelayed() ? ConnectionType.RELAYED : ConnectionType.DIRECT;
        }
        return ConnectionInfo.builder()
                .id(id)
                .deviceId(deviceId)
                .state(state)
                .type(type)
                .quality(quality)
                .statistics(statistics)
                .createdAt(createdAt)
                .lastActivity(lastActivity)
                .reconnectAttempts(reconnectAttempts)
                .failureReason(failureReason)
                .build();
    }
}
