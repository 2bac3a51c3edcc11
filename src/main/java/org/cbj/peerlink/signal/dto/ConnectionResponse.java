package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.cbj.peerlink.transport.SessionDescription;

import java.time.Instant;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class ConnectionResponse {
    private String requestId;
    private boolean accepted;
    private String from;
    private String to;
    private String error;
    private SessionDescription answer;
    private Instant timestamp;
}
