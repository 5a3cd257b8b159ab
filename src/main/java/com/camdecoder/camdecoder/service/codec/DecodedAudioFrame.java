package com.camdecoder.camdecoder.service.codec;

public interface DecodedAudioFrame extends AutoCloseable {

    int getSampleRate();

    int getChannels();

    int getSampleCount();

    @Override
    void close();
}
