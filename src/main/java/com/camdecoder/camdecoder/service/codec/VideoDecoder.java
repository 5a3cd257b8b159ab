package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;

import java.util.List;

/**
 * Stateful video decoder bound to one codec. Must be fed every packet in order, even those whose
 * output is not used, so reference frames stay correct.
 */
public interface VideoDecoder extends AutoCloseable {

    MediaCodec codec();

    /**
     * Decode one packet. The caller owns and must close the returned frames.
     *
     * @return zero or more frames completed by this packet
     */
    List<DecodedVideoFrame> decode(byte[] packet) throws DecodeException;

    @Override
    void close();
}
