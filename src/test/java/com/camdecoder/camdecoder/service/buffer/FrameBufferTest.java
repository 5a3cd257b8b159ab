package com.camdecoder.camdecoder.service.buffer;

import com.camdecoder.camdecoder.model.FrameRecord;
import com.camdecoder.camdecoder.model.MediaCodec;
import com.camdecoder.camdecoder.model.MediaKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.camdecoder.camdecoder.support.Frames.audio;
import static com.camdecoder.camdecoder.support.Frames.video;
import static org.junit.jupiter.api.Assertions.*;

class FrameBufferTest {

    private static List<Long> timestamps(List<FrameRecord> records) {
        return records.stream().map(FrameRecord::getTimestamp).collect(Collectors.toList());
    }

    @Test
    void testOverflowWithNonKeyframes_KeepsFirstTwenty() {
        FrameBuffer buffer = new FrameBuffer(20);

        for (int i = 0; i < 25; i++) {
            buffer.putVideo(video(i, false));
        }

        assertEquals(20, buffer.videoSize());
        List<Long> kept = timestamps(buffer.videoSnapshot());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, kept.get(i), "records pushed while the lane was full are discarded");
        }
        assertEquals(5, buffer.getDroppedFrames());
    }

    @Test
    void testKeyframeOnFullLane_EvictsOneNonKeyframe() {
        FrameBuffer buffer = new FrameBuffer(20);
        for (int i = 0; i < 20; i++) {
            buffer.putVideo(video(i, false));
        }

        buffer.putVideo(video(100, true));

        List<Long> kept = timestamps(buffer.videoSnapshot());
        assertEquals(20, kept.size());
        assertTrue(kept.contains(100L), "keyframe must be retained");
        assertFalse(kept.contains(0L), "oldest non-keyframe is the one evicted");
        for (int i = 1; i < 20; i++) {
            assertTrue(kept.contains((long) i));
        }
    }

    @Test
    void testKeyframeOnFullLane_NeverEvictsKeyframeWhileNonKeyframeExists() {
        FrameBuffer buffer = new FrameBuffer(4);
        buffer.putVideo(video(1, true));
        buffer.putVideo(video(2, true));
        buffer.putVideo(video(3, false));
        buffer.putVideo(video(4, true));

        buffer.putVideo(video(5, true));

        assertEquals(List.of(1L, 2L, 4L, 5L), timestamps(buffer.videoSnapshot()));
    }

    @Test
    void testKeyframeOnLaneOfOnlyKeyframes_DropsOldest() {
        FrameBuffer buffer = new FrameBuffer(3);
        buffer.putVideo(video(1, true));
        buffer.putVideo(video(2, true));
        buffer.putVideo(video(3, true));

        buffer.putVideo(video(4, true));

        assertEquals(List.of(2L, 3L, 4L), timestamps(buffer.videoSnapshot()));
    }

    @Test
    void testNonKeyframeOnFullLane_LeavesLaneUnchanged() {
        FrameBuffer buffer = new FrameBuffer(3);
        buffer.putVideo(video(1, true));
        buffer.putVideo(video(2, false));
        buffer.putVideo(video(3, false));
        List<Long> before = timestamps(buffer.videoSnapshot());

        buffer.putVideo(video(4, false));

        assertEquals(before, timestamps(buffer.videoSnapshot()));
    }

    @Test
    void testAudioOverflow_DropsOldest() {
        FrameBuffer buffer = new FrameBuffer(3);
        for (int i = 1; i <= 5; i++) {
            buffer.putAudio(audio(i));
        }

        assertEquals(3, buffer.audioSize());
        assertEquals(3, buffer.take(0).getRecord().getTimestamp());
        assertEquals(4, buffer.take(0).getRecord().getTimestamp());
        assertEquals(5, buffer.take(0).getRecord().getTimestamp());
    }

    @Test
    void testLanesNeverExceedCapacity() {
        FrameBuffer buffer = new FrameBuffer(5);
        for (int i = 0; i < 100; i++) {
            buffer.putVideo(video(i, i % 7 == 0));
            buffer.putAudio(audio(i));
            assertTrue(buffer.videoSize() <= 5);
            assertTrue(buffer.audioSize() <= 5);
        }
    }

    @Test
    void testTake_PrefersVideoOverAudio() {
        FrameBuffer buffer = new FrameBuffer();
        buffer.putAudio(audio(1));
        buffer.putAudio(audio(2));
        buffer.putVideo(video(10, true));
        buffer.putVideo(video(11, false));

        assertEquals(MediaKind.VIDEO, buffer.take(0).getLane());
        assertEquals(MediaKind.VIDEO, buffer.take(0).getLane());
        LaneFrame first = buffer.take(0);
        assertEquals(MediaKind.AUDIO, first.getLane());
        assertEquals(1, first.getRecord().getTimestamp());
        assertEquals(2, buffer.take(0).getRecord().getTimestamp());
        assertNull(buffer.take(0));
    }

    @Test
    void testTake_TagsRecordWithLaneItWasQueuedOn() {
        FrameBuffer buffer = new FrameBuffer();
        FrameRecord untagged = FrameRecord.builder()
                .codec(MediaCodec.H264)
                .payload(new byte[] {1})
                .timestamp(1)
                .keyframe(true)
                .build();
        buffer.putVideo(untagged);
        buffer.putAudio(audio(2));

        LaneFrame video = buffer.take(0);
        assertEquals(MediaKind.VIDEO, video.getLane());
        assertSame(untagged, video.getRecord());
        assertEquals(MediaKind.AUDIO, buffer.take(0).getLane());
    }

    @Test
    void testTake_ReturnsNullAfterTimeout() {
        FrameBuffer buffer = new FrameBuffer();

        long start = System.nanoTime();
        assertNull(buffer.take(50));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 40, "take should wait for the timeout, waited " + elapsedMs + "ms");
    }

    @Test
    void testTake_WakesWhenFramePushedFromAnotherThread() throws Exception {
        FrameBuffer buffer = new FrameBuffer();
        AtomicReference<LaneFrame> taken = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            taken.set(buffer.take(5000));
            done.countDown();
        });
        consumer.start();
        Thread.sleep(50);

        buffer.putAudio(audio(7));

        assertTrue(done.await(2, TimeUnit.SECONDS), "push should wake the waiting consumer");
        assertEquals(7, taken.get().getRecord().getTimestamp());
    }

    @Test
    void testShutdown_UnblocksWaitingTake() throws Exception {
        FrameBuffer buffer = new FrameBuffer();
        AtomicReference<LaneFrame> taken = new AtomicReference<>(new LaneFrame(MediaKind.VIDEO, video(1, true)));
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            taken.set(buffer.take(10_000));
            done.countDown();
        });
        consumer.start();
        Thread.sleep(50);

        buffer.shutdown();

        assertTrue(done.await(2, TimeUnit.SECONDS), "shutdown must release a blocked take");
        assertNull(taken.get());
    }

    @Test
    void testShutdown_DiscardsQueuedAndIgnoresLaterPuts() {
        FrameBuffer buffer = new FrameBuffer();
        buffer.putVideo(video(1, true));
        buffer.putAudio(audio(2));

        buffer.shutdown();
        buffer.shutdown();
        buffer.putVideo(video(3, true));
        buffer.putAudio(audio(4));

        assertTrue(buffer.isShutdown());
        assertEquals(0, buffer.videoSize());
        assertEquals(0, buffer.audioSize());
        assertNull(buffer.take(10));
    }

    @Test
    void testInvalidCapacity_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new FrameBuffer(0));
    }
}
