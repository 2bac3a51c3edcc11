package org.cbj.peerlink.transport;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class SessionDescription {
    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";

    private String type;   // offer, answer
    private String sdp;

    public static SessionDescription offer(String sdp) {
        return new SessionDescription(OFFER, sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription(ANSWER, sdp);
    }
}
