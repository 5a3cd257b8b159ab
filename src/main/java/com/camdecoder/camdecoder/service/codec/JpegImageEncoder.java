package com.camdecoder.camdecoder.service.codec;

import com.camdecoder.camdecoder.exception.ConversionException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Encodes snapshots to JPEG with ImageIO
 */
public class JpegImageEncoder implements ImageEncoder {

    public static final float DEFAULT_QUALITY = 0.9f;

    private final float quality;

    public JpegImageEncoder() {
        this(DEFAULT_QUALITY);
    }

    public JpegImageEncoder(float quality) {
        this.quality = quality;
    }

    @Override
    public byte[] encode(BufferedImage image) throws ConversionException {
        if (image == null) {
            throw new ConversionException("No image to encode");
        }

        BufferedImage rgb = toJpegCompatible(image);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new ConversionException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);

            writer.setOutput(out);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } catch (IOException e) {
            throw new ConversionException("JPEG encoding failed", e);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }

    /**
     * The JPEG writer rejects images with alpha, so those are redrawn onto a 3-byte BGR canvas
     */
    private BufferedImage toJpegCompatible(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        copy.getGraphics().drawImage(image, 0, 0, null);
        return copy;
    }
}
