package com.camdecoder.camdecoder.service.buffer;

import com.camdecoder.camdecoder.model.FrameRecord;
import com.camdecoder.camdecoder.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded two-lane (video/audio) frame queue between the camera connection and the decode thread.
 *
 * Any number of threads may call {@link #putVideo} / {@link #putAudio}; exactly one thread may call
 * {@link #take}. Both lanes share one lock and one condition so the consumer wakes up no matter
 * which lane received data.
 *
 * When the video lane is full a keyframe replaces the oldest non-keyframe, and a non-keyframe is
 * dropped. Keeping keyframes lets decoding recover cleanly after overload.
 */
public class FrameBuffer {

    private static final Logger logger = LoggerFactory.getLogger(FrameBuffer.class);

    public static final int DEFAULT_CAPACITY = 20;

    private final int capacity;
    private final Deque<FrameRecord> videoLane;
    private final Deque<FrameRecord> audioLane;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    // guarded by lock
    private boolean closed = false;
    private long droppedFrames = 0;

    public FrameBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public FrameBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.videoLane = new ArrayDeque<>(capacity);
        this.audioLane = new ArrayDeque<>(capacity);
    }

    /**
     * Queue a video record. Never blocks and never fails; under pressure the record or an older
     * non-keyframe may be discarded.
     */
    public void putVideo(FrameRecord record) {
        lock.lock();
        try {
            if (closed) {
                return;
            }

            if (videoLane.size() < capacity) {
                videoLane.addLast(record);
                notEmpty.signal();
                return;
            }

            if (!record.isKeyframe()) {
                droppedFrames++;
                logger.debug("Video lane full, dropping non-keyframe: codec={}, ts={}",
                        record.getCodec(), record.getTimestamp());
                return;
            }

            FrameRecord evicted = removeFirstNonKeyframe();
            if (evicted == null) {
                // lane holds nothing but keyframes
                evicted = videoLane.pollFirst();
            }
            droppedFrames++;
            logger.debug("Video lane full, evicted {} to keep keyframe ts={}", evicted, record.getTimestamp());

            videoLane.addLast(record);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queue an audio record, evicting the oldest audio record when the lane is full.
     */
    public void putAudio(FrameRecord record) {
        lock.lock();
        try {
            if (closed) {
                return;
            }

            if (audioLane.size() >= capacity) {
                audioLane.pollFirst();
                droppedFrames++;
            }
            audioLane.addLast(record);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the next record, video first. Waits up to {@code timeoutMs} when both lanes are empty.
     *
     * @return the next record tagged with its lane, or null if nothing arrived in time or the
     *         buffer was shut down
     */
    public LaneFrame take(long timeoutMs) {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            while (!closed) {
                FrameRecord video = videoLane.pollFirst();
                if (video != null) {
                    return new LaneFrame(MediaKind.VIDEO, video);
                }
                FrameRecord audio = audioLane.pollFirst();
                if (audio != null) {
                    return new LaneFrame(MediaKind.AUDIO, audio);
                }
                if (remaining <= 0L) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard everything queued and wake the consumer. Later puts are ignored. Safe to call twice.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            videoLane.clear();
            audioLane.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int videoSize() {
        lock.lock();
        try {
            return videoLane.size();
        } finally {
            lock.unlock();
        }
    }

    public int audioSize() {
        lock.lock();
        try {
            return audioLane.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the video lane, oldest first
     */
    public List<FrameRecord> videoSnapshot() {
        lock.lock();
        try {
            return new ArrayList<>(videoLane);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of records discarded or evicted because a lane was full
     */
    public long getDroppedFrames() {
        lock.lock();
        try {
            return droppedFrames;
        } finally {
            lock.unlock();
        }
    }

    private FrameRecord removeFirstNonKeyframe() {
        Iterator<FrameRecord> it = videoLane.iterator();
        while (it.hasNext()) {
            FrameRecord queued = it.next();
            if (!queued.isKeyframe()) {
                it.remove();
                return queued;
            }
        }
        return null;
    }
}
