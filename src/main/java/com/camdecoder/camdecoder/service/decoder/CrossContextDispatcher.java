package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands decoded payloads from the decode thread to the consumer executor.
 *
 * Submission never waits for the callback. With a single-threaded consumer executor, payloads of
 * one media kind run in the order they were submitted.
 */
public class CrossContextDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CrossContextDispatcher.class);

    private final ExecutorService consumerExecutor;

    public CrossContextDispatcher(ExecutorService consumerExecutor) {
        this.consumerExecutor = consumerExecutor;
    }

    /**
     * Schedule {@code callback} with the payload.
     *
     * @return false if the consumer executor no longer accepts work; the payload is dropped
     */
    public boolean dispatch(MediaKind kind, MediaCallback callback, byte[] payload, long timestampMs, int channel) {
        try {
            consumerExecutor.execute(() -> invoke(kind, callback, payload, timestampMs, channel));
            return true;
        } catch (RejectedExecutionException e) {
            logger.warn("Consumer executor unavailable, dropping {} payload ts={}: {}",
                    kind, timestampMs, e.getMessage());
            return false;
        }
    }

    /**
     * Run {@code task} on the consumer executor after every payload already dispatched. Runs it on
     * the calling thread if the executor no longer accepts work.
     */
    public void runAfterPending(Runnable task) {
        try {
            consumerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            task.run();
        }
    }

    /**
     * True once the consumer executor has been shut down. It never accepts work again.
     */
    public boolean isClosed() {
        return consumerExecutor.isShutdown();
    }

    private void invoke(MediaKind kind, MediaCallback callback, byte[] payload, long timestampMs, int channel) {
        CompletableFuture<Void> result;
        try {
            result = callback.onMedia(payload, timestampMs, channel);
        } catch (RuntimeException e) {
            logger.error("{} callback failed, ts={}", kind, timestampMs, e);
            return;
        }

        if (result != null) {
            result.whenComplete((ignored, error) -> {
                if (error != null) {
                    logger.error("{} callback completed exceptionally, ts={}: {}",
                            kind, timestampMs, error.getMessage());
                }
            });
        }
    }
}
