package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the codec handle of one lane. Starts unbound, binds to the codec of the first frame that
 * opens successfully, and never switches codec afterwards: a frame with another codec fails with
 * {@link DecodeException}.
 */
class CodecBinding<H extends AutoCloseable> {

    private static final Logger logger = LoggerFactory.getLogger(CodecBinding.class);

    @FunctionalInterface
    interface Opener<H> {
        H open(MediaCodec codec) throws DecodeException;
    }

    private final String lane;
    private MediaCodec codec;
    private H handle;

    CodecBinding(String lane) {
        this.lane = lane;
    }

    /**
     * Return the bound handle for {@code requested}, opening it on first use. If opening fails the
     * binding stays unbound so the next frame retries.
     */
    H bind(MediaCodec requested, Opener<H> opener) throws DecodeException {
        if (handle != null) {
            if (codec != requested) {
                throw new DecodeException(lane + " decoder is bound to " + codec
                        + ", refusing frame with codec " + requested);
            }
            return handle;
        }

        H opened = opener.open(requested);
        if (opened == null) {
            throw new DecodeException("No " + lane + " decoder for codec " + requested);
        }
        this.codec = requested;
        this.handle = opened;
        logger.info("{} decoder created, codec={}", lane, requested);
        return opened;
    }

    boolean isBound() {
        return handle != null;
    }

    MediaCodec getCodec() {
        return codec;
    }

    /**
     * Close the handle. Only called when the worker exits.
     */
    void release() {
        if (handle == null) {
            return;
        }
        try {
            handle.close();
            logger.debug("{} decoder released", lane);
        } catch (Exception e) {
            logger.warn("Error releasing {} decoder: {}", lane, e.getMessage());
        } finally {
            handle = null;
        }
    }
}
