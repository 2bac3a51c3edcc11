package org.cbj.peerlink.network;

import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.config.OptimizerProperties;
import org.cbj.peerlink.error.ErrorCode;
import org.cbj.peerlink.network.dto.BandwidthAverage;
import org.cbj.peerlink.network.dto.BandwidthMeasurement;
import org.cbj.peerlink.network.dto.NetworkConditions;
import org.cbj.peerlink.network.dto.QualitySettings;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Slf4j
public class NetworkOptimizer {

    static final BandwidthMeasurement FALLBACK_MEASUREMENT = BandwidthMeasurement.builder()
            .download(5_000_000).upload(1_000_000).latency(50).jitter(10)
            .build();

    private static final int JITTER_WINDOW = 5;
    private static final int STABILITY_WINDOW = 3;
    private static final double STABILITY_TOLERANCE = 0.2;

    private final OptimizerProperties properties;
    private final BandwidthProbe probe;
    private final NetworkMediumDetector mediumDetector;
    private final Random random;
    private final List<NetworkOptimizerListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService executor;

    private final Deque<BandwidthMeasurement> history = new ArrayDeque<>();
    private QualitySettings current = QualitySettings.DEFAULTS;
    private BandwidthMeasurement lastMeasurement;
    private NetworkConditions lastConditions;
    private NetworkConditions monitorBaseline;
    private ScheduledFuture<?> monitorTask;
    private volatile boolean destroyed = false;

    public NetworkOptimizer(OptimizerProperties properties, BandwidthProbe probe,
                            NetworkMediumDetector mediumDetector, Random random) {
        this.properties = properties;
        this.probe = probe;
        this.mediumDetector = mediumDetector;
        this.random = random;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("network-optimizer-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newSingleThreadScheduledExecutor(threadFactory);
        log.info("NetworkOptimizer initialized: monitorInterval={}, threshold={}",
                properties.getMonitorInterval(), properties.getAdaptationThreshold());
    }

    public void addListener(NetworkOptimizerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(NetworkOptimizerListener listener) {
        listeners.remove(listener);
    }

    public synchronized void start() {
        if (destroyed || monitorTask != null) {
            return;
        }
        long periodMs = properties.getMonitorInterval().toMillis();
        monitorTask = executor.scheduleWithFixedDelay(this::runMonitorCycle, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs the probe and records the result. A failed probe yields the last good measurement, or a
     * fixed estimate if there is none, and leaves the history untouched.
     */
    public BandwidthMeasurement measureBandwidth() {
        long startNanos = System.nanoTime();
        BandwidthProbe.ProbeResult result;
        try {
            result = probe.probe();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallbackMeasurement(e);
        } catch (Exception e) {
            return fallbackMeasurement(e);
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        BandwidthMeasurement measurement;
        synchronized (this) {
            measurement = BandwidthMeasurement.builder()
                    .download(result.getDownloadBps())
                    .upload(result.getUploadBps())
                    .latency(result.getLatencyMs())
                    .jitter(calculateJitter(result.getLatencyMs()))
                    .timestamp(Instant.now())
                    .durationMs(durationMs)
                    .build();
            history.addLast(measurement);
            while (history.size() > properties.getHistoryLength()) {
                history.removeFirst();
            }
            lastMeasurement = measurement;
        }
        log.debug("Bandwidth measured: download={}, upload={}, latency={}ms, duration={}ms",
                (long) measurement.getDownload(), (long) measurement.getUpload(), measurement.getLatency(), durationMs);
        emit(l -> l.onBandwidthMeasured(measurement));
        return measurement;
    }

    public NetworkConditions measureConditions() {
        BandwidthMeasurement bandwidth = measureBandwidth();
        NetworkConditions conditions;
        synchronized (this) {
            boolean stable = isStable();
            conditions = NetworkConditions.builder()
                    .bandwidth(bandwidth.getDownload())
                    .latency(bandwidth.getLatency())
                    .packetLoss(estimatePacketLoss(stable))
                    .jitter(bandwidth.getJitter())
                    .medium(mediumDetector.detect())
                    .stable(stable)
                    .build();
            lastConditions = conditions;
        }
        log.debug("Network conditions measured: {}", conditions);
        emit(l -> l.onConditionsMeasured(conditions));
        return conditions;
    }

    public CompletableFuture<NetworkConditions> measureConditionsAsync() {
        return CompletableFuture.supplyAsync(this::measureConditions, executor);
    }

    public QualitySettings adaptQuality(NetworkConditions conditions) {
        QualitySettings target = calculateOptimalSettings(conditions);
        boolean changed;
        QualitySettings result;
        synchronized (this) {
            changed = exceedsThreshold(current, target);
            if (changed) {
                current = target;
            }
            result = current;
        }
        if (changed) {
            log.info("Quality settings adapted: bandwidth={}, latency={}ms, bitrate={}, fps={}",
                    (long) conditions.getBandwidth(), conditions.getLatency(),
                    target.getVideo().getBitrate(), target.getVideo().getFps());
            emit(l -> l.onQualityAdapted(conditions, target));
        }
        return result;
    }

    /**
     * Immediate downgrade, applied regardless of the threshold.
     */
    public QualitySettings handleCongestion() {
        log.warn("Network congestion detected, reducing quality");
        QualitySettings congested;
        synchronized (this) {
            QualitySettings.Video video = current.getVideo();
            QualitySettings.Audio audio = current.getAudio();
            long minBitrate = QualitySettings.DEFAULTS.getMinBitrate();
            congested = QualitySettings.builder()
                    .video(new QualitySettings.Video(
                            Math.max(15, video.getFps() / 2),
                            Math.max(minBitrate, Math.round(video.getBitrate() * 0.3)),
                            new QualitySettings.Resolution(
                                    Math.max(640, video.getResolution().getWidth() / 2),
                                    Math.max(480, video.getResolution().getHeight() / 2))))
                    .audio(new QualitySettings.Audio(
                            Math.max(64_000L, audio.getBitrate() / 2), audio.getSampleRate(), 1))
                    .adaptiveBitrate(true)
                    .maxBitrate(current.getMaxBitrate() / 2)
                    .minBitrate(minBitrate)
                    .build();
            current = congested;
        }
        emit(l -> l.onCongestionHandled(congested));
        return congested;
    }

    public synchronized QualitySettings getCurrentQualitySettings() {
        return current;
    }

    // bypasses the threshold
    public void updateQualitySettings(QualitySettings settings) {
        synchronized (this) {
            current = settings;
        }
        log.info("Quality settings updated manually: {}", settings);
        emit(l -> l.onQualityUpdated(settings));
    }

    public synchronized List<BandwidthMeasurement> getBandwidthHistory() {
        return List.copyOf(history);
    }

    public synchronized BandwidthAverage getAverageBandwidth() {
        if (history.isEmpty()) {
            return BandwidthAverage.NONE;
        }
        double download = 0;
        double upload = 0;
        double latency = 0;
        for (BandwidthMeasurement measurement : history) {
            download += measurement.getDownload();
            upload += measurement.getUpload();
            latency += measurement.getLatency();
        }
        int count = history.size();
        return new BandwidthAverage(download / count, upload / count, latency / count);
    }

    public synchronized NetworkConditions getLastConditions() {
        return lastConditions;
    }

    public void resetToDefaults() {
        synchronized (this) {
            current = QualitySettings.DEFAULTS;
            history.clear();
            lastMeasurement = null;
            lastConditions = null;
            monitorBaseline = null;
        }
        log.info("Quality settings reset to defaults");
        emit(l -> l.onQualityReset(QualitySettings.DEFAULTS));
    }

    public void destroy() {
        if (destroyed) {
            return;
        }
        log.info("Destroying NetworkOptimizer");
        destroyed = true;
        executor.shutdownNow();
        listeners.clear();
        log.info("NetworkOptimizer destroyed");
    }

    void runMonitorCycle() {
        if (destroyed) {
            return;
        }
        try {
            checkForConditionChanges(measureConditions());
        } catch (Exception e) {
            log.debug("Monitoring cycle failed", e);
        }
    }

    void checkForConditionChanges(NetworkConditions conditions) {
        NetworkConditions previous;
        synchronized (this) {
            previous = monitorBaseline;
            monitorBaseline = conditions;
        }
        if (previous != null) {
            double bandwidthChange = relativeChange(previous.getBandwidth(), conditions.getBandwidth());
            double latencyChange = relativeChange(previous.getLatency(), conditions.getLatency());
            double threshold = properties.getAdaptationThreshold();
            if (bandwidthChange <= threshold && latencyChange <= threshold) {
                return;
            }
            log.debug("Significant network change: bandwidth {}%, latency {}%",
                    Math.round(bandwidthChange * 100), Math.round(latencyChange * 100));
        }
        emit(l -> l.onConditionsChanged(conditions));
        adaptQuality(conditions);
    }

    QualitySettings calculateOptimalSettings(NetworkConditions conditions) {
        QualitySettings defaults = QualitySettings.DEFAULTS;
        double bandwidth = conditions.getBandwidth();
        double bitrate = Math.min(bandwidth * 0.8, defaults.getMaxBitrate());
        double fps = defaults.getVideo().getFps();

        if (conditions.getLatency() > 150) {
            fps = Math.max(15, fps * 0.75);
            bitrate *= 0.8;
        } else if (conditions.getLatency() > 100) {
            fps = Math.max(20, fps * 0.9);
            bitrate *= 0.9;
        }

        if (conditions.getPacketLoss() > 0.02) {
            bitrate *= 0.7;
            fps = Math.max(15, fps * 0.8);
        } else if (conditions.getPacketLoss() > 0.01) {
            bitrate *= 0.85;
        }

        if (!conditions.isStable()) {
            bitrate *= 0.8;
            fps = Math.max(15, fps * 0.8);
        }

        bitrate = Math.max(defaults.getMinBitrate(), bitrate);

        QualitySettings.Resolution resolution;
        if (bitrate < 1_000_000) {
            resolution = new QualitySettings.Resolution(640, 480);
        } else if (bitrate < 2_000_000) {
            resolution = new QualitySettings.Resolution(1280, 720);
        } else {
            resolution = defaults.getVideo().getResolution();
        }

        QualitySettings.Audio audio;
        if (bandwidth < 1_000_000) {
            audio = new QualitySettings.Audio(64_000L, defaults.getAudio().getSampleRate(), 1);
        } else if (bandwidth < 2_000_000) {
            audio = new QualitySettings.Audio(96_000L, defaults.getAudio().getSampleRate(),
                    defaults.getAudio().getChannels());
        } else {
            audio = defaults.getAudio();
        }

        return QualitySettings.builder()
                .video(new QualitySettings.Video((int) Math.round(fps), Math.round(bitrate), resolution))
                .audio(audio)
                .adaptiveBitrate(true)
                .maxBitrate(defaults.getMaxBitrate())
                .minBitrate(defaults.getMinBitrate())
                .build();
    }

    private boolean exceedsThreshold(QualitySettings from, QualitySettings to) {
        double threshold = properties.getAdaptationThreshold();
        double bitrateChange = relativeChange(from.getVideo().getBitrate(), to.getVideo().getBitrate());
        double fpsChange = relativeChange(from.getVideo().getFps(), to.getVideo().getFps());
        return bitrateChange > threshold || fpsChange > threshold;
    }

    static double relativeChange(double before, double after) {
        if (before == 0) {
            return after == 0 ? 0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs(after - before) / Math.abs(before);
    }

    // population standard deviation over the latest latencies, including the one just measured
    private double calculateJitter(double latestLatency) {
        List<Double> latencies = new ArrayList<>();
        List<BandwidthMeasurement> recent = new ArrayList<>(history);
        for (int i = Math.max(0, recent.size() - (JITTER_WINDOW - 1)); i < recent.size(); i++) {
            latencies.add(recent.get(i).getLatency());
        }
        latencies.add(latestLatency);
        if (latencies.size() < 2) {
            return 0;
        }
        double mean = latencies.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = latencies.stream().mapToDouble(l -> (l - mean) * (l - mean)).sum() / latencies.size();
        return Math.sqrt(variance);
    }

    private boolean isStable() {
        if (history.size() < STABILITY_WINDOW) {
            return true;
        }
        List<BandwidthMeasurement> recent = new ArrayList<>(history).subList(history.size() - STABILITY_WINDOW, history.size());
        double mean = recent.stream().mapToDouble(BandwidthMeasurement::getDownload).average().orElse(0);
        if (mean == 0) {
            return true;
        }
        return recent.stream().allMatch(m -> Math.abs(m.getDownload() - mean) / mean < STABILITY_TOLERANCE);
    }

    private double estimatePacketLoss(boolean stable) {
        return random.nextDouble() * (stable ? 0.005 : 0.05);
    }

    private BandwidthMeasurement fallbackMeasurement(Exception cause) {
        BandwidthMeasurement cached;
        synchronized (this) {
            cached = lastMeasurement;
        }
        log.warn("{}, using {} estimate", ErrorCode.BANDWIDTH_MEASUREMENT_FAILED.getDefaultMessage(),
                cached != null ? "last measured" : "default", cause);
        BandwidthMeasurement base = cached != null ? cached : FALLBACK_MEASUREMENT;
        return base.toBuilder().timestamp(Instant.now()).build();
    }

    private void emit(Consumer<NetworkOptimizerListener> event) {
        for (NetworkOptimizerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Network optimizer listener failed", e);
            }
        }
    }
}
