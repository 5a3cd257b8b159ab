package com.camdecoder.camdecoder.service.decoder;

import com.camdecoder.camdecoder.model.VideoQuality;
import com.camdecoder.camdecoder.service.buffer.FrameBuffer;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DecoderSettings {

    @Builder.Default
    private final long frameIntervalMs = 500;

    @Builder.Default
    private final boolean enableAudio = true;

    @Builder.Default
    private final int bufferCapacity = FrameBuffer.DEFAULT_CAPACITY;

    // how long one idle poll of the buffer waits
    @Builder.Default
    private final long pollTimeoutMs = 200;

    @Builder.Default
    private final VideoQuality quality = VideoQuality.MEDIUM;
}
