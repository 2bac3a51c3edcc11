package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.cbj.peerlink.transport.SessionDescription;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class HandshakeOptions {
    private SessionDescription offer;
    private boolean reconnect;   // redrives an existing connection with a fresh transport
}
