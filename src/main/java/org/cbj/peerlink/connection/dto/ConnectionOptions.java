package org.cbj.peerlink.connection.dto;

import lombok.Builder;
import lombok.Value;
import org.cbj.peerlink.transport.ChannelSpec;
import org.cbj.peerlink.transport.TransportConfig;

import java.time.Duration;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class ConnectionOptions {
    Duration timeout;
    List<ChannelSpec> channels;
    TransportConfig transportConfig;
    @Builder.Default
    boolean enableReconnect = true;
    Integer maxReconnectAttempts;
    Duration reconnectDelay;

    public static ConnectionOptions defaults() {
        return ConnectionOptions.builder().build();
    }
}
