package com.camdecoder.camdecoder.service.quality;

import com.camdecoder.camdecoder.config.CameraProperties;
import com.camdecoder.camdecoder.model.VideoQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the stream quality for a camera from configuration
 */
@Component
public class CameraQualityResolver {

    private static final Logger logger = LoggerFactory.getLogger(CameraQualityResolver.class);

    private final CameraProperties properties;

    public CameraQualityResolver(CameraProperties properties) {
        this.properties = properties;
    }

    /**
     * The camera's own quality if configured and valid, else the default quality, else MEDIUM
     */
    public VideoQuality resolve(String cameraId) {
        Integer configured = properties.getCameraQualities().get(cameraId);
        if (configured != null) {
            try {
                return VideoQuality.fromValue(configured);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid quality value {} for camera {}, using default", configured, cameraId);
            }
        }
        return defaultQuality();
    }

    public VideoQuality defaultQuality() {
        try {
            return VideoQuality.fromValue(properties.getDefaultQuality());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid default_quality {}, using MEDIUM", properties.getDefaultQuality());
            return VideoQuality.MEDIUM;
        }
    }
}
