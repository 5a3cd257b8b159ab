package com.camdecoder.camdecoder.exception;

public class MediaDecoderException extends RuntimeException {

    public MediaDecoderException(String message) {
        super(message);
    }

    public MediaDecoderException(String message, Throwable cause) {
        super(message, cause);
    }
}
