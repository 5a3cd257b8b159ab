package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import com.camdecoder.camdecoder.service.codec.AudioDecoder;
import com.camdecoder.camdecoder.service.codec.AudioResampler;
import com.camdecoder.camdecoder.service.codec.CodecFactory;

/**
 * Audio decoder and resampler, bound and released together
 */
class AudioPipeline implements AutoCloseable {

    final AudioDecoder decoder;
    final AudioResampler resampler;

    private AudioPipeline(AudioDecoder decoder, AudioResampler resampler) {
        this.decoder = decoder;
        this.resampler = resampler;
    }

    static AudioPipeline open(CodecFactory factory, MediaCodec codec) throws DecodeException {
        AudioDecoder decoder = factory.createAudioDecoder(codec);
        try {
            return new AudioPipeline(decoder, factory.createAudioResampler(codec));
        } catch (DecodeException | RuntimeException e) {
            decoder.close();
            throw e;
        }
    }

    @Override
    public void close() {
        try {
            resampler.close();
        } finally {
            decoder.close();
        }
    }
}
