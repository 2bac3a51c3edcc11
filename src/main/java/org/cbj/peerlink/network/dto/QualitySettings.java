package org.cbj.peerlink.network.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class QualitySettings {

    public static final QualitySettings DEFAULTS = QualitySettings.builder()
            .video(new Video(30, 2_000_000L, new Resolution(1920, 1080)))
            .audio(new Audio(128_000L, 44_100, 2))
            .adaptiveBitrate(true)
            .maxBitrate(10_000_000L)
            .minBitrate(500_000L)
            .build();

    Video video;
    Audio audio;
    boolean adaptiveBitrate;
    long maxBitrate;
    long minBitrate;

    @Value
    public static class Video {
        int fps;
        long bitrate;
        Resolution resolution;
    }

    @Value
    public static class Resolution {
        int width;
        int height;
    }

    @Value
    public static class Audio {
        long bitrate;
        int sampleRate;
        int channels;
    }
}
