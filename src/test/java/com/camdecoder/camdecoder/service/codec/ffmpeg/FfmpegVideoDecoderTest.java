package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import org.bytedeco.ffmpeg.avutil.AVBufferRef;
import org.bytedeco.ffmpeg.global.avutil;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FfmpegVideoDecoderTest {

    @Test
    void testSoftwareDecoder_OpensAndCloses() throws Exception {
        for (MediaCodec codec : new MediaCodec[] {MediaCodec.H264, MediaCodec.H265}) {
            FfmpegVideoDecoder decoder = new FfmpegVideoDecoder(codec, false);
            assertEquals(codec, decoder.codec());
            decoder.close();
            decoder.close();
        }
    }

    @Test
    void testDecode_AfterClose_Throws() throws Exception {
        FfmpegVideoDecoder decoder = new FfmpegVideoDecoder(MediaCodec.H264, false);
        decoder.close();

        assertThrows(DecodeException.class, () -> decoder.decode(new byte[] {0, 0, 0, 1}));
    }

    @Test
    void testOpenFailure_ReleasesDeviceReference() {
        AVBufferRef device = avutil.av_buffer_alloc(16);
        AVBufferRef handedOver = avutil.av_buffer_ref(device);
        assertEquals(2, avutil.av_buffer_get_ref_count(device));

        assertThrows(DecodeException.class, () -> new FfmpegVideoDecoder(MediaCodec.H264, handedOver,
                (codec, configure) -> {
                    throw new DecodeException("avcodec_open2 failed for " + codec.getDecoderName());
                }));

        assertEquals(1, avutil.av_buffer_get_ref_count(device));
        avutil.av_buffer_unref(device);
    }
}
