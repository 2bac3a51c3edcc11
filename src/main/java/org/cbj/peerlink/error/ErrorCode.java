package org.cbj.peerlink.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // peer transport
    TRANSPORT_CREATE_FAILED("Failed to create peer transport"),
    OFFER_CREATE_FAILED("Failed to create offer"),
    ANSWER_CREATE_FAILED("Failed to create answer"),
    REMOTE_DESCRIPTION_FAILED("Failed to apply remote description"),
    ICE_CANDIDATE_FAILED("Failed to apply remote candidate"),
    NO_SUCH_CONNECTION("Peer transport not found"),
    CHANNEL_CREATE_FAILED("Failed to create channel"),
    CHANNEL_NOT_FOUND("Channel not found"),
    CHANNEL_NOT_OPEN("Channel not open"),
    DATA_SEND_FAILED("Failed to send data"),

    // signaling
    CONNECTION_TIMEOUT("Signaling connection timeout"),
    CONNECTION_FAILED("Signaling connection failed"),
    CONNECTION_REJECTED("Connection rejected"),
    REQUEST_TIMEOUT("Connection request timeout"),
    DISCONNECTED("Signaling client disconnected"),
    DISCOVERY_FAILED("Device discovery failed"),

    // orchestration
    CONNECTION_INIT_FAILED("Connection initialization failed"),
    CONNECTION_NOT_FOUND("Connection not found"),
    CONNECTION_NOT_READY("Connection not ready"),
    MANAGER_DESTROYED("Connection manager is destroyed"),

    // network optimizer
    BANDWIDTH_MEASUREMENT_FAILED("Bandwidth measurement failed");

    private final String defaultMessage;
}
