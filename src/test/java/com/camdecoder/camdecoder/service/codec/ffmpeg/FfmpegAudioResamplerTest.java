package com.camdecoder.camdecoder.service.codec.ffmpeg;

import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avutil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FfmpegAudioResamplerTest {

    private final FfmpegAudioResampler resampler = new FfmpegAudioResampler();

    @AfterEach
    void tearDown() {
        resampler.close();
    }

    private static FfmpegAudioFrame stereoS16(int sampleRate, int samples) {
        AVFrame frame = avutil.av_frame_alloc();
        frame.format(avutil.AV_SAMPLE_FMT_S16);
        frame.sample_rate(sampleRate);
        frame.nb_samples(samples);
        avutil.av_channel_layout_default(frame.ch_layout(), 2);
        assertTrue(avutil.av_frame_get_buffer(frame, 0) >= 0, "av_frame_get_buffer");
        return new FfmpegAudioFrame(frame);
    }

    @Test
    void testResample_StereoAt48k_ProducesMonoS16At16k() throws Exception {
        int totalBytes = 0;
        for (int i = 0; i < 10; i++) {
            FfmpegAudioFrame frame = stereoS16(48_000, 480);
            try {
                byte[] pcm = resampler.resample(frame);
                assertEquals(0, pcm.length % 2, "whole 16-bit mono samples");
                assertTrue(pcm.length <= 2 * 170, "about 160 samples per 10ms, got " + pcm.length + " bytes");
                totalBytes += pcm.length;
            } finally {
                frame.close();
            }
        }

        // 100ms of input is 1600 mono samples, minus the resampler's filter delay
        int samples = totalBytes / 2;
        assertTrue(samples > 1450 && samples <= 1600, "got " + samples + " samples");
    }

    @Test
    void testResample_InputFormatChange_RebuildsContext() throws Exception {
        FfmpegAudioFrame first = stereoS16(48_000, 480);
        FfmpegAudioFrame second = stereoS16(16_000, 160);
        try {
            resampler.resample(first);
            byte[] pcm = resampler.resample(second);

            assertTrue(pcm.length > 0);
            assertTrue(pcm.length <= 2 * 200);
        } finally {
            first.close();
            second.close();
        }
    }
}
