package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.ConversionException;
import com.camdecoder.camdecoder.service.codec.AudioResampler;
import com.camdecoder.camdecoder.service.codec.DecodedAudioFrame;
import org.bytedeco.ffmpeg.avutil.AVChannelLayout;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.ffmpeg.global.swresample;
import org.bytedeco.ffmpeg.swresample.SwrContext;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.PointerPointer;

/**
 * swresample conversion to s16 mono 16 kHz. The context is created from the first frame and
 * rebuilt if the input format changes.
 */
class FfmpegAudioResampler implements AudioResampler {

    private static final int BYTES_PER_SAMPLE = 2;

    private SwrContext swr;
    private int inSampleRate = -1;
    private int inFormat = -1;
    private int inChannels = -1;

    @Override
    public byte[] resample(DecodedAudioFrame decoded) throws ConversionException {
        if (!(decoded instanceof FfmpegAudioFrame)) {
            throw new ConversionException("Unsupported audio frame type: " + decoded.getClass().getName());
        }
        AVFrame in = ((FfmpegAudioFrame) decoded).getAvFrame();
        if (in == null) {
            throw new ConversionException("Frame already released");
        }
        ensureContext(in);

        int maxOut = swresample.swr_get_out_samples(swr, in.nb_samples());
        if (maxOut <= 0) {
            return new byte[0];
        }

        BytePointer out = new BytePointer((long) maxOut * BYTES_PER_SAMPLE * TARGET_CHANNELS);
        PointerPointer<BytePointer> outData = new PointerPointer<>(out);
        try {
            int converted = swresample.swr_convert(swr, outData, maxOut, in.extended_data(), in.nb_samples());
            if (converted < 0) {
                throw new ConversionException("swr_convert failed: " + FfmpegSupport.errorString(converted));
            }
            byte[] pcm = new byte[converted * BYTES_PER_SAMPLE * TARGET_CHANNELS];
            out.get(pcm, 0, pcm.length);
            return pcm;
        } finally {
            outData.close();
            out.close();
        }
    }

    private void ensureContext(AVFrame in) throws ConversionException {
        int channels = in.ch_layout().nb_channels();
        if (swr != null && in.sample_rate() == inSampleRate && in.format() == inFormat && channels == inChannels) {
            return;
        }
        close();

        AVChannelLayout inLayout = new AVChannelLayout();
        AVChannelLayout outLayout = new AVChannelLayout();
        try {
            if (channels > 0 && in.ch_layout().order() != avutil.AV_CHANNEL_ORDER_UNSPEC) {
                avutil.av_channel_layout_copy(inLayout, in.ch_layout());
            } else {
                avutil.av_channel_layout_default(inLayout, Math.max(channels, 1));
            }
            avutil.av_channel_layout_default(outLayout, TARGET_CHANNELS);

            SwrContext ctx = swresample.swr_alloc();
            if (ctx == null || ctx.isNull()) {
                throw new ConversionException("swr_alloc failed");
            }
            avutil.av_opt_set_chlayout(ctx, "in_chlayout", inLayout, 0);
            avutil.av_opt_set_int(ctx, "in_sample_rate", in.sample_rate(), 0);
            avutil.av_opt_set_sample_fmt(ctx, "in_sample_fmt", in.format(), 0);
            avutil.av_opt_set_chlayout(ctx, "out_chlayout", outLayout, 0);
            avutil.av_opt_set_int(ctx, "out_sample_rate", TARGET_SAMPLE_RATE, 0);
            avutil.av_opt_set_sample_fmt(ctx, "out_sample_fmt", avutil.AV_SAMPLE_FMT_S16, 0);

            int ret = swresample.swr_init(ctx);
            if (ret < 0) {
                swresample.swr_free(ctx);
                throw new ConversionException("swr_init failed: " + FfmpegSupport.errorString(ret));
            }
            swr = ctx;
            inSampleRate = in.sample_rate();
            inFormat = in.format();
            inChannels = channels;
        } finally {
            avutil.av_channel_layout_uninit(inLayout);
            avutil.av_channel_layout_uninit(outLayout);
        }
    }

    @Override
    public void close() {
        if (swr != null) {
            swresample.swr_free(swr);
            swr = null;
        }
    }
}
