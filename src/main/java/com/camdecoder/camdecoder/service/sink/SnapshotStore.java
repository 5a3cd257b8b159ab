package com.camdecoder.camdecoder.service.sink;

import com.camdecoder.camdecoder.service.decoder.MediaCallback;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the most recent JPEG snapshot and PCM chunk of every camera
 */
@Component
public class SnapshotStore {

    @Getter
    @AllArgsConstructor
    public static class MediaSample {
        private final byte[] data;
        private final long timestamp;
        private final int channel;
        private final long receivedAt;
    }

    private final Map<String, MediaSample> latestSnapshots = new ConcurrentHashMap<>();
    private final Map<String, MediaSample> latestAudio = new ConcurrentHashMap<>();

    public MediaCallback videoCallbackFor(String cameraId) {
        return (payload, timestampMs, channel) -> {
            latestSnapshots.put(cameraId, new MediaSample(payload, timestampMs, channel, System.currentTimeMillis()));
            return CompletableFuture.completedFuture(null);
        };
    }

    public MediaCallback audioCallbackFor(String cameraId) {
        return (payload, timestampMs, channel) -> {
            latestAudio.put(cameraId, new MediaSample(payload, timestampMs, channel, System.currentTimeMillis()));
            return CompletableFuture.completedFuture(null);
        };
    }

    public MediaSample getLatestSnapshot(String cameraId) {
        return latestSnapshots.get(cameraId);
    }

    public MediaSample getLatestAudio(String cameraId) {
        return latestAudio.get(cameraId);
    }

    public void clear(String cameraId) {
        latestSnapshots.remove(cameraId);
        latestAudio.remove(cameraId);
    }
}
