package org.cbj.peerlink.signal.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalType {
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    CONNECTION_REQUEST("connection-request"),
    CONNECTION_RESPONSE("connection-response"),
    CONNECTION_CLOSE("connection-close"),
    DEVICE_DISCOVERY("device-discovery"),
    DEVICE_RESPONSE("device-response"),
    HEARTBEAT("heartbeat"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SignalType fromWireName(String value) {
        for (SignalType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
