package org.cbj.peerlink.network;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;

@Slf4j
public class HttpBandwidthProbe implements BandwidthProbe {

    private final RestTemplate restTemplate;
    private final String url;
    private final int uploadBytes;

    public HttpBandwidthProbe(RestTemplate restTemplate, String url, int uploadBytes) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.uploadBytes = uploadBytes;
    }

    @Override
    public ProbeResult probe() {
        long start = System.nanoTime();
        restTemplate.headForHeaders(url);
        double latencyMs = elapsedMs(start);

        start = System.nanoTime();
        byte[] body = restTemplate.getForObject(url, byte[].class);
        double downloadMs = elapsedMs(start);
        int downloaded = body != null ? body.length : 0;

        start = System.nanoTime();
        restTemplate.postForLocation(url, new byte[uploadBytes]);
        double uploadMs = elapsedMs(start);

        log.debug("HTTP probe {}: latency={}ms, downloaded={}B in {}ms, uploaded={}B in {}ms",
                url, latencyMs, downloaded, downloadMs, uploadBytes, uploadMs);
        return new ProbeResult(bitsPerSecond(downloaded, downloadMs), bitsPerSecond(uploadBytes, uploadMs), latencyMs);
    }

    static double bitsPerSecond(long bytes, double elapsedMs) {
        return bytes * 8.0 / (Math.max(elapsedMs, 1.0) / 1000.0);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
