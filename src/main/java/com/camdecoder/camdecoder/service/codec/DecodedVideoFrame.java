package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.ConversionException;

import java.awt.image.BufferedImage;

/**
 * A decoded picture. Conversion to an image is deferred so frames that are only decoded for
 * reference state cost nothing extra.
 */
public interface DecodedVideoFrame extends AutoCloseable {

    int getWidth();

    int getHeight();

    BufferedImage toImage() throws ConversionException;

    @Override
    void close();
}
