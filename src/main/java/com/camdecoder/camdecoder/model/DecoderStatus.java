package com.camdecoder.camdecoder.model;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class DecoderStatus {
    private String cameraId;
    private String state; // CREATED | RUNNING | STOPPING | STOPPED
    private VideoQuality quality;
    private long frameIntervalMs;
    private long videoEmitted;
    private long audioEmitted;
    private long decodeErrors;
    private long droppedFrames;
    private LocalDateTime startTime;
}
