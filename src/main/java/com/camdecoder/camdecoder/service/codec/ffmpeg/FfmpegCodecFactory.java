package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import com.camdecoder.camdecoder.model.MediaKind;
import com.camdecoder.camdecoder.service.codec.AudioDecoder;
import com.camdecoder.camdecoder.service.codec.AudioResampler;
import com.camdecoder.camdecoder.service.codec.CodecFactory;
import com.camdecoder.camdecoder.service.codec.VideoDecoder;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegLogCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec handles backed by FFmpeg through JavaCV's bundled libraries
 */
public class FfmpegCodecFactory implements CodecFactory {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCodecFactory.class);

    private final boolean preferHardware;
    private final HardwareAccelerationProbe probe;

    public FfmpegCodecFactory(boolean preferHardware, HardwareAccelerationProbe probe) {
        this.preferHardware = preferHardware;
        this.probe = probe;

        // Suppress FFmpeg logging
        FFmpegLogCallback.set();
        avutil.av_log_set_level(avutil.AV_LOG_FATAL);
    }

    @Override
    public VideoDecoder createVideoDecoder(MediaCodec codec) throws DecodeException {
        requireKind(codec, MediaKind.VIDEO);
        boolean useHardware = preferHardware && probe.isAvailable();
        if (!useHardware) {
            logger.info("Using software decoder for {}", codec);
        }
        try {
            return new FfmpegVideoDecoder(codec, useHardware);
        } catch (DecodeException e) {
            if (!useHardware) {
                throw e;
            }
            logger.warn("Failed to init HW decoder for {}: {}, fallback to software", codec, e.getMessage());
            return new FfmpegVideoDecoder(codec, false);
        }
    }

    @Override
    public AudioDecoder createAudioDecoder(MediaCodec codec) throws DecodeException {
        requireKind(codec, MediaKind.AUDIO);
        return new FfmpegAudioDecoder(codec);
    }

    @Override
    public AudioResampler createAudioResampler(MediaCodec codec) throws DecodeException {
        requireKind(codec, MediaKind.AUDIO);
        return new FfmpegAudioResampler();
    }

    private static void requireKind(MediaCodec codec, MediaKind kind) throws DecodeException {
        if (codec == null || codec.getKind() != kind) {
            throw new DecodeException("Unsupported " + kind.name().toLowerCase() + " codec: " + codec);
        }
    }
}
