package org.cbj.peerlink.network;

import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.network.dto.NetworkMedium;

import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;

@Slf4j
public class NetworkMediumDetector {

    public NetworkMedium detect() {
        try {
            Enumeration<NetworkInterface> found = NetworkInterface.getNetworkInterfaces();
            if (found == null) {
                return NetworkMedium.UNKNOWN;
            }
            List<NetworkInterface> interfaces = Collections.list(found);
            for (NetworkInterface networkInterface : interfaces) {
                if (!networkInterface.isUp() || networkInterface.isLoopback() || networkInterface.isVirtual()) {
                    continue;
                }
                NetworkMedium medium = classify(networkInterface.getName());
                if (medium != NetworkMedium.UNKNOWN) {
                    return medium;
                }
            }
        } catch (SocketException e) {
            log.debug("Unable to enumerate network interfaces", e);
        }
        return NetworkMedium.UNKNOWN;
    }

    static NetworkMedium classify(String interfaceName) {
        if (interfaceName == null) {
            return NetworkMedium.UNKNOWN;
        }
        String name = interfaceName.toLowerCase(Locale.ROOT);
        if (name.startsWith("wl") || name.startsWith("wi-fi") || name.startsWith("wifi") || name.startsWith("ath")) {
            return NetworkMedium.WIFI;
        }
        if (name.startsWith("wwan") || name.startsWith("rmnet") || name.startsWith("ppp") || name.startsWith("ccmni")) {
            return NetworkMedium.CELLULAR;
        }
        if (name.startsWith("eth") || name.startsWith("en")) {
            return NetworkMedium.ETHERNET;
        }
        return NetworkMedium.UNKNOWN;
    }
}
