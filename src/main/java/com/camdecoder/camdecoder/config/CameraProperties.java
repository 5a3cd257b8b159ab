package com.camdecoder.camdecoder.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * The {@code camera} section of application.yml
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "camera")
public class CameraProperties {

    // minimum spacing between JPEG snapshots, ms
    private long frameInterval = 500;

    private int bufferCapacity = 20;

    private boolean enableAudio = true;

    private boolean enableHwAccel = true;

    // 1 = LOW, 2 = MEDIUM, 3 = HIGH
    private int defaultQuality = 2;

    // camera id -> quality (1..3)
    private Map<String, Integer> cameraQualities = new HashMap<>();
}
