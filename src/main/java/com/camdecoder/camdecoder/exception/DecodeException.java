package com.camdecoder.camdecoder.exception;

/**
 * A packet could not be decoded, or a decoder could not be created for its codec
 */
public class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
