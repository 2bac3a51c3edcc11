package org.cbj.peerlink.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceInfo {
    private String name = "PeerLink Device";
    private String type = "desktop";
    private List<String> capabilities = new ArrayList<>(List.of("screen-capture", "remote-control", "file-transfer"));
    private String ip;
    private int port;
}
