package com.camdecoder.camdecoder.exception;

/**
 * A decoded frame could not be turned into its output format (JPEG image or PCM samples)
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
