package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.cbj.peerlink.transport.IceCandidate;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class CandidatePayload {
    private String sessionId;    // requestId of the handshake that produced the transport
    private IceCandidate candidate;
}
