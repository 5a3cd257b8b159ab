package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.config.CameraProperties;
import com.camdecoder.camdecoder.model.DecoderStatus;
import com.camdecoder.camdecoder.model.VideoQuality;
import com.camdecoder.camdecoder.service.codec.JpegImageEncoder;
import com.camdecoder.camdecoder.service.quality.CameraQualityResolver;
import com.camdecoder.camdecoder.service.sink.SnapshotStore;
import com.camdecoder.camdecoder.support.FakeCodecFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.camdecoder.camdecoder.support.Frames.audio;
import static com.camdecoder.camdecoder.support.Frames.video;
import static org.junit.jupiter.api.Assertions.*;

class MediaDecoderServiceTest {

    private ExecutorService consumer;
    private FakeCodecFactory codecs;
    private SnapshotStore snapshotStore;
    private MediaDecoderService service;

    @BeforeEach
    void setUp() {
        CameraProperties properties = new CameraProperties();
        properties.setFrameInterval(0);
        properties.setDefaultQuality(1);
        properties.getCameraQualities().put("front-door", 3);

        consumer = Executors.newSingleThreadExecutor();
        codecs = new FakeCodecFactory();
        snapshotStore = new SnapshotStore();
        service = new MediaDecoderService(properties, new CameraQualityResolver(properties), codecs,
                new JpegImageEncoder(), new CrossContextDispatcher(consumer), snapshotStore);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        consumer.shutdownNow();
    }

    private void drainConsumer() throws Exception {
        consumer.submit(() -> { }).get(2, TimeUnit.SECONDS);
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(5);
        }
    }

    @Test
    void testStartDecoder_Twice_ReturnsFalse() {
        assertTrue(service.startDecoder("front-door"));
        assertFalse(service.startDecoder("front-door"));
        assertTrue(service.isRunning("front-door"));
    }

    @Test
    void testStopDecoder_UnknownCamera_ReturnsFalse() {
        assertFalse(service.stopDecoder("missing"));
    }

    @Test
    void testPushToUnknownCamera_IsIgnored() {
        service.pushVideoFrame("missing", video(1, true));
        service.pushAudioFrame("missing", audio(2));

        assertTrue(codecs.decodedVideo.isEmpty());
        assertTrue(codecs.decodedAudio.isEmpty());
    }

    @Test
    void testPushedFrames_ReachSnapshotStore() throws Exception {
        service.startDecoder("front-door");

        service.pushVideoFrame("front-door", video(5, true));
        service.pushAudioFrame("front-door", audio(6));

        await(() -> snapshotStore.getLatestSnapshot("front-door") != null, "snapshot should arrive");
        await(() -> snapshotStore.getLatestAudio("front-door") != null, "audio should arrive");

        SnapshotStore.MediaSample snapshot = snapshotStore.getLatestSnapshot("front-door");
        assertEquals(5, snapshot.getTimestamp());
        assertEquals(0, snapshot.getChannel());
        assertEquals((byte) 0xFF, snapshot.getData()[0]);
        assertEquals(6, snapshotStore.getLatestAudio("front-door").getTimestamp());
    }

    @Test
    void testStatus_ReportsQualityAndCounters() throws Exception {
        service.startDecoder("front-door");
        service.startDecoder("garage");
        service.pushVideoFrame("front-door", video(1, true));
        await(() -> service.getDecoderStatus().get("front-door").getVideoEmitted() == 1, "snapshot should be emitted");

        Map<String, DecoderStatus> status = service.getDecoderStatus();

        assertEquals(2, status.size());
        DecoderStatus frontDoor = status.get("front-door");
        assertEquals("RUNNING", frontDoor.getState());
        assertEquals(VideoQuality.HIGH, frontDoor.getQuality());
        assertEquals(1, frontDoor.getVideoEmitted());
        assertNotNull(frontDoor.getStartTime());
        assertEquals(VideoQuality.LOW, status.get("garage").getQuality());
    }

    @Test
    void testStopDecoder_ClearsSnapshotAndAllowsRestart() throws Exception {
        service.startDecoder("front-door");
        service.pushVideoFrame("front-door", video(1, true));
        await(() -> snapshotStore.getLatestSnapshot("front-door") != null, "snapshot should arrive");

        assertTrue(service.stopDecoder("front-door"));
        drainConsumer();

        assertFalse(service.isRunning("front-door"));
        assertNull(snapshotStore.getLatestSnapshot("front-door"));
        assertTrue(codecs.videoDecoders.get(0).closed);
        assertTrue(service.startDecoder("front-door"));
    }

    @Test
    void testStopDecoder_QueuedCallbacksDoNotRefillSnapshot() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        consumer.execute(() -> {
            try {
                release.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        service.startDecoder("front-door");
        service.pushVideoFrame("front-door", video(1, true));
        await(() -> service.getDecoderStatus().get("front-door").getVideoEmitted() == 1, "snapshot should be queued");

        service.stopDecoder("front-door");
        release.countDown();
        drainConsumer();

        assertNull(snapshotStore.getLatestSnapshot("front-door"));
    }

    @Test
    void testShutdown_StopsEveryDecoder() {
        service.startDecoder("a");
        service.startDecoder("b");

        service.shutdown();

        assertFalse(service.isRunning("a"));
        assertFalse(service.isRunning("b"));
        assertTrue(service.getDecoderStatus().isEmpty());
    }
}
