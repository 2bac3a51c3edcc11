package org.cbj.peerlink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeerLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeerLinkApplication.class, args);
    }
}
