package org.cbj.peerlink.network;

import java.util.Random;

public class SimulatedBandwidthProbe implements BandwidthProbe {

    static final int TEST_PAYLOAD_BYTES = 1024 * 1024;

    private final Random random;

    public SimulatedBandwidthProbe(Random random) {
        this.random = random;
    }

    @Override
    public ProbeResult probe() throws InterruptedException {
        long downloadMs = pause(50, 100);
        long uploadMs = pause(75, 150);
        long latencyMs = pause(25, 50);
        return new ProbeResult(throughput(downloadMs), throughput(uploadMs), latencyMs);
    }

    private long pause(int minMs, int spreadMs) throws InterruptedException {
        long ms = minMs + (long) (random.nextDouble() * spreadMs);
        Thread.sleep(ms);
        return ms;
    }

    private static double throughput(long elapsedMs) {
        return TEST_PAYLOAD_BYTES * 8.0 / (Math.max(1, elapsedMs) / 1000.0);
    }
}
