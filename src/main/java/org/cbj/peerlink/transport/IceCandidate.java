package org.cbj.peerlink.transport;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
@EqualsAndHashCode
public class IceCandidate {
    private String sdpMid;
    private int sdpMLineIndex;
    private String candidate;
}
