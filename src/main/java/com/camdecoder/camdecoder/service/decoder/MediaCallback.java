package com.camdecoder.camdecoder.service.decoder;

import java.util.concurrent.CompletableFuture;

/**
 * Consumer of decoded output. Invoked on the consumer executor, never on the decode thread.
 */
@FunctionalInterface
public interface MediaCallback {

    CompletableFuture<Void> onMedia(byte[] payload, long timestampMs, int channel);
}
