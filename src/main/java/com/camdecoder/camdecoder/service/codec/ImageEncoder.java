package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.ConversionException;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface ImageEncoder {

    byte[] encode(BufferedImage image) throws ConversionException;
}
