package com.camdecoder.camdecoder.exception;

/**
 * Thrown while building a decoder when its settings cannot work, e.g. audio enabled without an audio callback
 */
public class ConfigurationException extends MediaDecoderException {

    public ConfigurationException(String message) {
        super(message);
    }
}
