package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;

import java.util.List;

public interface AudioDecoder extends AutoCloseable {

    MediaCodec codec();

    /**
     * Decode one packet. The caller owns and must close the returned frames.
     */
    List<DecodedAudioFrame> decode(byte[] packet) throws DecodeException;

    @Override
    void close();
}
