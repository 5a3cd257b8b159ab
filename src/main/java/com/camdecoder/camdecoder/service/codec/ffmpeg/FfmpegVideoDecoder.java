package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import com.camdecoder.camdecoder.service.codec.DecodedVideoFrame;
import com.camdecoder.camdecoder.service.codec.VideoDecoder;
import org.bytedeco.ffmpeg.avcodec.AVCodecContext;
import org.bytedeco.ffmpeg.avcodec.AVPacket;
import org.bytedeco.ffmpeg.avutil.AVBufferRef;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacpp.Pointer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * H.264 / HEVC decoder over libavcodec, optionally backed by a VAAPI device
 */
class FfmpegVideoDecoder implements VideoDecoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoDecoder.class);

    // libavcodec's FF_THREAD_FRAME / FF_THREAD_SLICE, not exported by the Java presets
    private static final int FF_THREAD_FRAME = 1;
    private static final int FF_THREAD_SLICE = 2;

    interface ContextOpener {
        AVCodecContext open(MediaCodec codec, Consumer<AVCodecContext> configure) throws DecodeException;
    }

    private final MediaCodec codec;
    private final AVPacket packet;
    private final AVFrame frame;
    private AVCodecContext context;
    private AVBufferRef hwDevice;

    FfmpegVideoDecoder(MediaCodec codec, boolean useHardware) throws DecodeException {
        this(codec, useHardware ? createVaapiDevice() : null, FfmpegSupport::openDecoder);
    }

    /**
     * Takes ownership of {@code hwDevice}, which is released if the decoder cannot be opened
     */
    FfmpegVideoDecoder(MediaCodec codec, AVBufferRef hwDevice, ContextOpener opener) throws DecodeException {
        this.codec = codec;
        this.hwDevice = hwDevice;

        try {
            this.context = opener.open(codec, ctx -> {
                // let FFmpeg pick the thread count
                ctx.thread_count(0);
                ctx.thread_type(FF_THREAD_FRAME | FF_THREAD_SLICE);
                if (hwDevice != null) {
                    ctx.hw_device_ctx(avutil.av_buffer_ref(hwDevice));
                }
            });
        } catch (DecodeException | RuntimeException e) {
            releaseHwDevice();
            throw e;
        }
        this.packet = avcodec.av_packet_alloc();
        this.frame = avutil.av_frame_alloc();

        logger.info("Created {} decoder ({})", codec.getDecoderName(), hwDevice != null ? "vaapi" : "software");
    }

    @Override
    public MediaCodec codec() {
        return codec;
    }

    @Override
    public List<DecodedVideoFrame> decode(byte[] data) throws DecodeException {
        if (context == null) {
            throw new DecodeException("Decoder closed");
        }
        FfmpegSupport.sendPacket(context, packet, data);

        List<DecodedVideoFrame> frames = new ArrayList<>();
        try {
            while (FfmpegSupport.receiveFrame(context, frame)) {
                try {
                    frames.add(new FfmpegVideoFrame(toSystemMemory(frame)));
                } finally {
                    avutil.av_frame_unref(frame);
                }
            }
        } catch (DecodeException | RuntimeException e) {
            frames.forEach(DecodedVideoFrame::close);
            throw e;
        }
        return frames;
    }

    @Override
    public void close() {
        if (context == null) {
            return;
        }
        avcodec.avcodec_free_context(context);
        context = null;
        avcodec.av_packet_free(packet);
        avutil.av_frame_free(frame);
        releaseHwDevice();
    }

    private void releaseHwDevice() {
        if (hwDevice != null) {
            avutil.av_buffer_unref(hwDevice);
            hwDevice = null;
        }
    }

    /**
     * Hardware surfaces are downloaded, software frames are referenced
     */
    private AVFrame toSystemMemory(AVFrame decoded) throws DecodeException {
        AVFrame copy = avutil.av_frame_alloc();
        if (copy == null || copy.isNull()) {
            throw new DecodeException("av_frame_alloc failed");
        }

        int ret;
        if (decoded.hw_frames_ctx() != null && !decoded.hw_frames_ctx().isNull()) {
            ret = avutil.av_hwframe_transfer_data(copy, decoded, 0);
        } else {
            ret = avutil.av_frame_ref(copy, decoded);
        }
        if (ret < 0) {
            avutil.av_frame_free(copy);
            throw new DecodeException("Copying decoded frame failed: " + FfmpegSupport.errorString(ret));
        }
        return copy;
    }

    private static AVBufferRef createVaapiDevice() {
        AVBufferRef device = new AVBufferRef((Pointer) null);
        int ret = avutil.av_hwdevice_ctx_create(device, avutil.AV_HWDEVICE_TYPE_VAAPI, (String) null, null, 0);
        if (ret < 0 || device.isNull()) {
            logger.warn("Failed to init VAAPI device: {}, fallback to software", FfmpegSupport.errorString(ret));
            return null;
        }
        return device;
    }
}
