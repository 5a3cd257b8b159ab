package com.camdecoder.camdecoder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

// One encoded media unit as received from the camera connection
@Getter
@AllArgsConstructor
@Builder
public class FrameRecord {
    private final MediaKind mediaKind;
    private final MediaCodec codec;
    private final byte[] payload;
    private final long timestamp; // capture time, ms
    private final int channel;
    private final boolean keyframe; // video only

    @Override
    public String toString() {
        return "FrameRecord{" + mediaKind + ", " + codec + ", ts=" + timestamp
                + ", channel=" + channel + ", keyframe=" + keyframe
                + ", size=" + (payload == null ? 0 : payload.length) + "}";
    }
}
