package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;

/**
 * Creates codec handles for a decode worker
 */
public interface CodecFactory {

    /**
     * @throws DecodeException if the codec is not a supported video codec or the decoder cannot be opened
     */
    VideoDecoder createVideoDecoder(MediaCodec codec) throws DecodeException;

    /**
     * @throws DecodeException if the codec is not a supported audio codec or the decoder cannot be opened
     */
    AudioDecoder createAudioDecoder(MediaCodec codec) throws DecodeException;

    AudioResampler createAudioResampler(MediaCodec codec) throws DecodeException;
}
