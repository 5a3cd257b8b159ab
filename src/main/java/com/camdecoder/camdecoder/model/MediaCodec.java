package com.camdecoder.camdecoder.model;

/**
 * Codec identifiers carried by camera frames, with the FFmpeg decoder used for each
 */
public enum MediaCodec {
    H264(MediaKind.VIDEO, "h264"),
    H265(MediaKind.VIDEO, "hevc"),
    OPUS(MediaKind.AUDIO, "opus"),
    PCM_ALAW(MediaKind.AUDIO, "pcm_alaw"),
    PCM_MULAW(MediaKind.AUDIO, "pcm_mulaw");

    private final MediaKind kind;
    private final String decoderName;

    MediaCodec(MediaKind kind, String decoderName) {
        this.kind = kind;
        this.decoderName = decoderName;
    }

    public MediaKind getKind() { return kind; }
    public String getDecoderName() { return decoderName; }
}
