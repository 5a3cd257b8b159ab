package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.exception.ConfigurationException;
import com.camdecoder.camdecoder.exception.ConversionException;
import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.FrameRecord;
import com.camdecoder.camdecoder.model.MediaKind;
import com.camdecoder.camdecoder.service.buffer.FrameBuffer;
import com.camdecoder.camdecoder.service.buffer.LaneFrame;
import com.camdecoder.camdecoder.service.codec.CodecFactory;
import com.camdecoder.camdecoder.service.codec.DecodedAudioFrame;
import com.camdecoder.camdecoder.service.codec.DecodedVideoFrame;
import com.camdecoder.camdecoder.service.codec.ImageEncoder;
import com.camdecoder.camdecoder.service.codec.VideoDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decodes the frames of one camera on a dedicated thread.
 *
 * Producers push encoded frames from any thread; the worker drains its {@link FrameBuffer},
 * decodes every packet, turns at most one picture per frame interval into a JPEG, converts all
 * audio to PCM, and hands the results to the consumer executor through a
 * {@link CrossContextDispatcher}.
 *
 * Lifecycle: CREATED → RUNNING → STOPPING → STOPPED. A stopped worker cannot be restarted.
 */
public class DecodeWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DecodeWorker.class);

    private static final long JOIN_TIMEOUT_MS = 5000;

    private final String name;
    private final DecoderSettings settings;
    private final FrameBuffer buffer;
    private final CodecFactory codecFactory;
    private final ImageEncoder imageEncoder;
    private final CrossContextDispatcher dispatcher;
    private final MediaCallback videoCallback;
    private final MediaCallback audioCallback;
    private final RateGate rateGate;
    private final Clock clock;

    // touched only by the worker thread
    private final CodecBinding<VideoDecoder> videoBinding = new CodecBinding<>("Video");
    private final CodecBinding<AudioPipeline> audioBinding = new CodecBinding<>("Audio");

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.CREATED);
    private volatile boolean stopRequested = false;
    private volatile Thread thread;
    private volatile LocalDateTime startTime;

    private final AtomicLong videoEmitted = new AtomicLong();
    private final AtomicLong audioEmitted = new AtomicLong();
    private final AtomicLong decodeErrors = new AtomicLong();

    public DecodeWorker(String name,
                        DecoderSettings settings,
                        CodecFactory codecFactory,
                        ImageEncoder imageEncoder,
                        CrossContextDispatcher dispatcher,
                        MediaCallback videoCallback,
                        MediaCallback audioCallback) {
        this(name, settings, codecFactory, imageEncoder, dispatcher, videoCallback, audioCallback,
                Clock.systemUTC());
    }

    public DecodeWorker(String name,
                        DecoderSettings settings,
                        CodecFactory codecFactory,
                        ImageEncoder imageEncoder,
                        CrossContextDispatcher dispatcher,
                        MediaCallback videoCallback,
                        MediaCallback audioCallback,
                        Clock clock) {
        if (videoCallback == null) {
            throw new ConfigurationException("videoCallback is required");
        }
        if (settings.isEnableAudio() && audioCallback == null) {
            throw new ConfigurationException("audioCallback is required when audio is enabled");
        }
        this.name = name;
        this.settings = settings;
        this.codecFactory = Objects.requireNonNull(codecFactory, "codecFactory");
        this.imageEncoder = Objects.requireNonNull(imageEncoder, "imageEncoder");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.videoCallback = videoCallback;
        this.audioCallback = audioCallback;
        this.clock = clock;
        this.buffer = new FrameBuffer(settings.getBufferCapacity());
        this.rateGate = new RateGate(settings.getFrameIntervalMs());
    }

    /**
     * Start the decode thread.
     *
     * @throws IllegalStateException if the worker was already started or stopped
     */
    public void start() {
        if (!state.compareAndSet(WorkerState.CREATED, WorkerState.RUNNING)) {
            throw new IllegalStateException("Decoder " + name + " cannot start from state " + state.get());
        }
        startTime = LocalDateTime.now();

        Thread t = new Thread(this);
        t.setName("decoder-" + name);
        t.setDaemon(true);
        thread = t;
        t.start();
        logger.info("Decoder {} started, frameInterval={}ms, audio={}",
                name, settings.getFrameIntervalMs(), settings.isEnableAudio());
    }

    /**
     * Stop decoding. Queued frames are discarded and nothing more is dispatched. Waits for the
     * iteration in progress to finish. Safe to call more than once.
     */
    public void stop() {
        if (state.compareAndSet(WorkerState.CREATED, WorkerState.STOPPED)) {
            stopRequested = true;
            buffer.shutdown();
            // no thread ever ran, so nothing else holds the handles
            videoBinding.release();
            audioBinding.release();
            return;
        }
        if (!state.compareAndSet(WorkerState.RUNNING, WorkerState.STOPPING)) {
            return;
        }

        logger.info("Stopping decoder {}", name);
        stopRequested = true;
        buffer.shutdown();

        Thread t = thread;
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        try {
            t.join(JOIN_TIMEOUT_MS);
            if (t.isAlive()) {
                logger.warn("Decoder {} did not stop within {}ms", name, JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void pushVideoFrame(FrameRecord record) {
        buffer.putVideo(record);
    }

    public void pushAudioFrame(FrameRecord record) {
        if (!settings.isEnableAudio()) {
            return;
        }
        buffer.putAudio(record);
    }

    @Override
    public void run() {
        try {
            while (!stopRequested) {
                if (dispatcher.isClosed()) {
                    logger.warn("Consumer executor closed, decoder {} exits", name);
                    break;
                }
                try {
                    step();
                } catch (Exception e) {
                    logger.error("Frame data handle error in decoder {}: {}", name, e.getMessage(), e);
                    if (dispatcher.isClosed()) {
                        break;
                    }
                }
            }
        } finally {
            stopRequested = true;
            buffer.shutdown();
            videoBinding.release();
            audioBinding.release();
            state.set(WorkerState.STOPPED);
            logger.info("Decoder {} stopped", name);
        }
    }

    /**
     * One iteration: take a frame, waiting briefly if none is queued, and process it
     */
    void step() {
        LaneFrame taken = buffer.take(settings.getPollTimeoutMs());
        if (taken == null) {
            return;
        }
        if (taken.getLane() == MediaKind.VIDEO) {
            handleVideo(taken.getRecord());
        } else {
            handleAudio(taken.getRecord());
        }
    }

    private void handleVideo(FrameRecord record) {
        VideoDecoder decoder;
        List<DecodedVideoFrame> frames;
        try {
            decoder = videoBinding.bind(record.getCodec(), codecFactory::createVideoDecoder);
            frames = decoder.decode(record.getPayload());
        } catch (DecodeException e) {
            decodeErrors.incrementAndGet();
            logger.error("Video decode failed, dropping {}: {}", record, e.getMessage());
            return;
        }

        try {
            // every packet is decoded, only gated ticks are converted
            if (!rateGate.tryAcquire(clock.millis())) {
                return;
            }
            if (frames.isEmpty()) {
                logger.debug("No picture at emission tick, codec={}, ts={}", record.getCodec(), record.getTimestamp());
                return;
            }

            byte[] jpeg;
            try {
                jpeg = imageEncoder.encode(frames.get(0).toImage());
            } catch (ConversionException | RuntimeException e) {
                logger.error("Failed to process video frame ts={}: {}", record.getTimestamp(), e.getMessage());
                return;
            }

            if (forward(MediaKind.VIDEO, videoCallback, jpeg, record)) {
                videoEmitted.incrementAndGet();
            }
        } finally {
            for (DecodedVideoFrame frame : frames) {
                frame.close();
            }
        }
    }

    private void handleAudio(FrameRecord record) {
        AudioPipeline pipeline;
        List<DecodedAudioFrame> frames;
        try {
            pipeline = audioBinding.bind(record.getCodec(), codec -> AudioPipeline.open(codecFactory, codec));
            frames = pipeline.decoder.decode(record.getPayload());
        } catch (DecodeException e) {
            decodeErrors.incrementAndGet();
            logger.error("Audio decode failed, dropping {}: {}", record, e.getMessage());
            return;
        }

        try {
            // forwarded even when empty, one payload per audio packet
            ByteArrayOutputStream pcm = new ByteArrayOutputStream();
            for (DecodedAudioFrame frame : frames) {
                try {
                    pcm.writeBytes(pipeline.resampler.resample(frame));
                } catch (ConversionException | RuntimeException e) {
                    logger.warn("Audio resample failed, ts={}: {}", record.getTimestamp(), e.getMessage());
                }
            }

            if (forward(MediaKind.AUDIO, audioCallback, pcm.toByteArray(), record)) {
                audioEmitted.incrementAndGet();
            }
        } finally {
            for (DecodedAudioFrame frame : frames) {
                frame.close();
            }
        }
    }

    private boolean forward(MediaKind kind, MediaCallback callback, byte[] payload, FrameRecord record) {
        if (stopRequested) {
            return false;
        }
        return dispatcher.dispatch(kind, callback, payload, record.getTimestamp(), record.getChannel());
    }

    public String getName() { return name; }
    public WorkerState getState() { return state.get(); }
    public DecoderSettings getSettings() { return settings; }
    public LocalDateTime getStartTime() { return startTime; }
    public long getVideoEmitted() { return videoEmitted.get(); }
    public long getAudioEmitted() { return audioEmitted.get(); }
    public long getDecodeErrors() { return decodeErrors.get(); }
    public long getDroppedFrames() { return buffer.getDroppedFrames(); }

    FrameBuffer getBuffer() { return buffer; }
}
