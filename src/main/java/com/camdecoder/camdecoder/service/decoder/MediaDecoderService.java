package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.config.CameraProperties;
import com.camdecoder.camdecoder.model.DecoderStatus;
import com.camdecoder.camdecoder.model.FrameRecord;
import com.camdecoder.camdecoder.service.codec.CodecFactory;
import com.camdecoder.camdecoder.service.codec.ImageEncoder;
import com.camdecoder.camdecoder.service.quality.CameraQualityResolver;
import com.camdecoder.camdecoder.service.sink.SnapshotStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one {@link DecodeWorker} per camera and routes incoming frames to it
 */
@Service
public class MediaDecoderService {

    private static final Logger logger = LoggerFactory.getLogger(MediaDecoderService.class);

    private final Map<String, DecodeWorker> workers = new ConcurrentHashMap<>();

    private final CameraProperties properties;
    private final CameraQualityResolver qualityResolver;
    private final CodecFactory codecFactory;
    private final ImageEncoder imageEncoder;
    private final CrossContextDispatcher dispatcher;
    private final SnapshotStore snapshotStore;

    public MediaDecoderService(CameraProperties properties,
                               CameraQualityResolver qualityResolver,
                               CodecFactory codecFactory,
                               ImageEncoder imageEncoder,
                               CrossContextDispatcher dispatcher,
                               SnapshotStore snapshotStore) {
        this.properties = properties;
        this.qualityResolver = qualityResolver;
        this.codecFactory = codecFactory;
        this.imageEncoder = imageEncoder;
        this.dispatcher = dispatcher;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Start decoding for a camera
     *
     * @return true if started, false if a decoder is already running for it
     */
    public boolean startDecoder(String cameraId) {
        DecoderSettings settings = DecoderSettings.builder()
                .frameIntervalMs(properties.getFrameInterval())
                .enableAudio(properties.isEnableAudio())
                .bufferCapacity(properties.getBufferCapacity())
                .quality(qualityResolver.resolve(cameraId))
                .build();

        DecodeWorker worker = new DecodeWorker(
                cameraId,
                settings,
                codecFactory,
                imageEncoder,
                dispatcher,
                snapshotStore.videoCallbackFor(cameraId),
                settings.isEnableAudio() ? snapshotStore.audioCallbackFor(cameraId) : null);

        DecodeWorker existing = workers.putIfAbsent(cameraId, worker);
        if (existing != null) {
            // a worker that exited on its own can be replaced
            if (existing.getState() != WorkerState.STOPPED || !workers.replace(cameraId, existing, worker)) {
                return false;
            }
        }

        worker.start();
        logger.info("Decoder started for camera {} (quality={})", cameraId, settings.getQuality());
        return true;
    }

    /**
     * @return false if no decoder was registered for the camera
     */
    public boolean stopDecoder(String cameraId) {
        DecodeWorker worker = workers.remove(cameraId);
        if (worker == null) {
            return false;
        }
        worker.stop();
        // callbacks the worker already queued must not refill the store
        dispatcher.runAfterPending(() -> snapshotStore.clear(cameraId));
        logger.info("Decoder stopped for camera {}", cameraId);
        return true;
    }

    public void pushVideoFrame(String cameraId, FrameRecord record) {
        DecodeWorker worker = workers.get(cameraId);
        if (worker == null) {
            logger.debug("No decoder for camera {}, ignoring video frame", cameraId);
            return;
        }
        worker.pushVideoFrame(record);
    }

    public void pushAudioFrame(String cameraId, FrameRecord record) {
        DecodeWorker worker = workers.get(cameraId);
        if (worker == null) {
            logger.debug("No decoder for camera {}, ignoring audio frame", cameraId);
            return;
        }
        worker.pushAudioFrame(record);
    }

    public boolean isRunning(String cameraId) {
        DecodeWorker worker = workers.get(cameraId);
        return worker != null && worker.getState() == WorkerState.RUNNING;
    }

    public Map<String, DecoderStatus> getDecoderStatus() {
        Map<String, DecoderStatus> status = new LinkedHashMap<>();
        workers.forEach((cameraId, worker) -> status.put(cameraId, DecoderStatus.builder()
                .cameraId(cameraId)
                .state(worker.getState().name())
                .quality(worker.getSettings().getQuality())
                .frameIntervalMs(worker.getSettings().getFrameIntervalMs())
                .videoEmitted(worker.getVideoEmitted())
                .audioEmitted(worker.getAudioEmitted())
                .decodeErrors(worker.getDecodeErrors())
                .droppedFrames(worker.getDroppedFrames())
                .startTime(worker.getStartTime())
                .build()));
        return status;
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Stopping {} decoder(s)", workers.size());
        for (String cameraId : workers.keySet()) {
            stopDecoder(cameraId);
        }
    }
}
