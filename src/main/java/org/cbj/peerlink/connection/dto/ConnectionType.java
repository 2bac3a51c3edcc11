package org.cbj.peerlink.connection.dto;

public enum ConnectionType {
    DIRECT,
    RELAYED,
    UNKNOWN
}
