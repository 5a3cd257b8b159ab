package com.camdecoder.camdecoder.service.buffer;

import com.camdecoder.camdecoder.model.FrameRecord;
import com.camdecoder.camdecoder.model.MediaKind;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A record taken from a {@link FrameBuffer}, tagged with the lane it was queued on
 */
@Getter
@AllArgsConstructor
public class LaneFrame {
    private final MediaKind lane;
    private final FrameRecord record;
}
