package org.cbj.peerlink.signal.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class SignalMessage {
    public static final String BROADCAST = "broadcast";
    public static final String SERVER = "server";

    private SignalType type;     // offer, answer, ice-candidate, connection-request ...
    private String from;         // sending device id
    private String to;           // target device id or "broadcast"
    private Object data;         // type-specific payload
    private String messageId;
    private Instant timestamp;

    public static SignalMessage of(SignalType type, String from, String to, Object data) {
        return new SignalMessage(type, from, to, data, UUID.randomUUID().toString(), Instant.now());
    }

    @JsonIgnore
    public boolean isBroadcast() {
        return BROADCAST.equals(to);
    }
}
