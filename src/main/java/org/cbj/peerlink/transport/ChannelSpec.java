package org.cbj.peerlink.transport;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelSpec {
    private String label;
    private boolean ordered = true;
    private Integer maxRetransmits;      // null = fully reliable
    private Integer maxPacketLifeTime;   // ms, null = unlimited
    private String protocol;

    public static ChannelSpec ordered(String label) {
        return new ChannelSpec(label, true, null, null, null);
    }

    public static ChannelSpec unordered(String label, int maxRetransmits) {
        return new ChannelSpec(label, false, maxRetransmits, null, null);
    }
}
