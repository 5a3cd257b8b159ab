package com.camdecoder.camdecoder.model;

/**
 * Stream quality requested from a camera. Values match the 1..3 scale used in configuration.
 */
public enum VideoQuality {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int value;

    VideoQuality(int value) {
        this.value = value;
    }

    public int getValue() { return value; }

    /**
     * @throws IllegalArgumentException if the value is not 1, 2 or 3
     */
    public static VideoQuality fromValue(int value) {
        for (VideoQuality quality : values()) {
            if (quality.value == value) {
                return quality;
            }
        }
        throw new IllegalArgumentException("Invalid video quality: " + value + " (must be 1, 2 or 3)");
    }
}
