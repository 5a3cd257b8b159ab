package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.DecodeException;
import com.camdecoder.camdecoder.model.MediaCodec;
import com.camdecoder.camdecoder.service.codec.AudioDecoder;
import com.camdecoder.camdecoder.service.codec.DecodedAudioFrame;
import org.bytedeco.ffmpeg.avcodec.AVCodecContext;
import org.bytedeco.ffmpeg.avcodec.AVPacket;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;

import java.util.ArrayList;
import java.util.List;

class FfmpegAudioDecoder implements AudioDecoder {

    // G.711 from cameras is 8 kHz mono; the PCM decoders need the format up front
    private static final int G711_SAMPLE_RATE = 8000;

    private final MediaCodec codec;
    private final AVPacket packet;
    private final AVFrame frame;
    private AVCodecContext context;

    FfmpegAudioDecoder(MediaCodec codec) throws DecodeException {
        this.codec = codec;
        this.context = FfmpegSupport.openDecoder(codec, ctx -> {
            if (codec == MediaCodec.PCM_ALAW || codec == MediaCodec.PCM_MULAW) {
                ctx.sample_rate(G711_SAMPLE_RATE);
                avutil.av_channel_layout_default(ctx.ch_layout(), 1);
            }
        });
        this.packet = avcodec.av_packet_alloc();
        this.frame = avutil.av_frame_alloc();
    }

    @Override
    public MediaCodec codec() {
        return codec;
    }

    @Override
    public List<DecodedAudioFrame> decode(byte[] data) throws DecodeException {
        if (context == null) {
            throw new DecodeException("Decoder closed");
        }
        FfmpegSupport.sendPacket(context, packet, data);

        List<DecodedAudioFrame> frames = new ArrayList<>();
        try {
            while (FfmpegSupport.receiveFrame(context, frame)) {
                AVFrame copy = avutil.av_frame_alloc();
                int ret = avutil.av_frame_ref(copy, frame);
                avutil.av_frame_unref(frame);
                if (ret < 0) {
                    avutil.av_frame_free(copy);
                    throw new DecodeException("av_frame_ref failed: " + FfmpegSupport.errorString(ret));
                }
                frames.add(new FfmpegAudioFrame(copy));
            }
        } catch (DecodeException | RuntimeException e) {
            frames.forEach(DecodedAudioFrame::close);
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
    }
}
