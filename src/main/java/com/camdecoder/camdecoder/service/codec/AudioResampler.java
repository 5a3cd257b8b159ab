package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.ConversionException;

/**
 * Converts decoded audio to 16-bit little-endian mono PCM at 16 kHz
 */
public interface AudioResampler extends AutoCloseable {

    int TARGET_SAMPLE_RATE = 16_000;
    int TARGET_CHANNELS = 1;

    byte[] resample(DecodedAudioFrame frame) throws ConversionException;

    @Override
    void close();
}
