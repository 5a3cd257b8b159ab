package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.service.codec.DecodedAudioFrame;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avutil;

class FfmpegAudioFrame implements DecodedAudioFrame {

    private AVFrame frame;

    FfmpegAudioFrame(AVFrame frame) {
        this.frame = frame;
    }

    @Override
    public int getSampleRate() {
        return frame.sample_rate();
    }

    @Override
    public int getChannels() {
        return frame.ch_layout().nb_channels();
    }

    @Override
    public int getSampleCount() {
        return frame.nb_samples();
    }

    AVFrame getAvFrame() {
        return frame;
    }

    @Override
    public void close() {
        if (frame != null) {
            avutil.av_frame_free(frame);
            frame = null;
        }
    }
}
