package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import org.bytedeco.ffmpeg.avcodec.AVCodec;
import org.bytedeco.ffmpeg.avcodec.AVCodecContext;
import org.bytedeco.ffmpeg.avcodec.AVPacket;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacpp.PointerPointer;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Shared libavcodec plumbing for the decoders
 */
final class FfmpegSupport {

    private FfmpegSupport() {
    }

    /**
     * Find, configure and open the FFmpeg decoder for {@code codec}
     */
    static AVCodecContext openDecoder(MediaCodec codec, Consumer<AVCodecContext> configure) throws DecodeException {
        AVCodec decoder = avcodec.avcodec_find_decoder_by_name(codec.getDecoderName());
        if (decoder == null || decoder.isNull()) {
            throw new DecodeException("FFmpeg decoder not found: " + codec.getDecoderName());
        }

        AVCodecContext context = avcodec.avcodec_alloc_context3(decoder);
        if (context == null || context.isNull()) {
            throw new DecodeException("avcodec_alloc_context3 failed for " + codec.getDecoderName());
        }

        configure.accept(context);

        int ret = avcodec.avcodec_open2(context, decoder, (PointerPointer<?>) null);
        if (ret < 0) {
            avcodec.avcodec_free_context(context);
            throw new DecodeException("avcodec_open2 failed for " + codec.getDecoderName() + ": " + errorString(ret));
        }
        return context;
    }

    /**
     * Copy {@code data} into {@code packet} and send it to the decoder
     */
    static void sendPacket(AVCodecContext context, AVPacket packet, byte[] data) throws DecodeException {
        if (data == null || data.length == 0) {
            throw new DecodeException("Empty packet");
        }
        int ret = avcodec.av_new_packet(packet, data.length);
        if (ret < 0) {
            throw new DecodeException("av_new_packet failed: " + errorString(ret));
        }
        try {
            packet.data().put(data);
            ret = avcodec.avcodec_send_packet(context, packet);
            if (ret < 0 && ret != avutil.AVERROR_EAGAIN()) {
                throw new DecodeException("avcodec_send_packet failed: " + errorString(ret));
            }
        } finally {
            avcodec.av_packet_unref(packet);
        }
    }

    /**
     * Receive the next decoded frame into {@code frame}.
     *
     * @return false once the decoder needs more input
     */
    static boolean receiveFrame(AVCodecContext context, AVFrame frame) throws DecodeException {
        int ret = avcodec.avcodec_receive_frame(context, frame);
        if (ret == avutil.AVERROR_EAGAIN() || ret == avutil.AVERROR_EOF) {
            return false;
        }
        if (ret < 0) {
            throw new DecodeException("avcodec_receive_frame failed: " + errorString(ret));
        }
        return true;
    }

    static String errorString(int errorCode) {
        byte[] buf = new byte[avutil.AV_ERROR_MAX_STRING_SIZE];
        if (avutil.av_strerror(errorCode, buf, buf.length) < 0) {
            return "error " + errorCode;
        }
        int len = 0;
        while (len < buf.length && buf[len] != 0) {
            len++;
        }
        return new String(buf, 0, len, StandardCharsets.US_ASCII) + " (" + errorCode + ")";
    }
}
