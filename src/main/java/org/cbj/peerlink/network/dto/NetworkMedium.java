package org.cbj.peerlink.network.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NetworkMedium {
    ETHERNET,
    WIFI,
    CELLULAR,
    UNKNOWN;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
