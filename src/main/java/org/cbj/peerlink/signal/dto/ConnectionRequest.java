package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class ConnectionRequest {
    private String requestId;
    private String from;
    private String to;
    private HandshakeOptions options;
    private Instant timestamp;
}
