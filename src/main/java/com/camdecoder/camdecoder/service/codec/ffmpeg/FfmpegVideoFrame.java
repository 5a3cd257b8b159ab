package com.camdecoder.camdecoder.service.codec.ffmpeg;

import com.camdecoder.camdecoder.exception.ConversionException;
import com.camdecoder.camdecoder.service.codec.DecodedVideoFrame;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.ffmpeg.global.swscale;
import org.bytedeco.ffmpeg.swscale.SwsContext;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.Java2DFrameConverter;

import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;

/**
 * Decoded picture in system memory. Owns its AVFrame reference until closed.
 */
class FfmpegVideoFrame implements DecodedVideoFrame {

    private AVFrame frame;

    FfmpegVideoFrame(AVFrame frame) {
        this.frame = frame;
    }

    @Override
    public int getWidth() {
        return frame.width();
    }

    @Override
    public int getHeight() {
        return frame.height();
    }

    /**
     * Scale to packed BGR24 and convert with JavaCV's {@link Java2DFrameConverter}
     */
    @Override
    public BufferedImage toImage() throws ConversionException {
        if (frame == null) {
            throw new ConversionException("Frame already released");
        }
        int width = frame.width();
        int height = frame.height();
        if (width <= 0 || height <= 0) {
            throw new ConversionException("Invalid frame size " + width + "x" + height);
        }

        SwsContext sws = swscale.sws_getContext(
                width, height, frame.format(),
                width, height, avutil.AV_PIX_FMT_BGR24,
                swscale.SWS_BILINEAR, null, null, (DoublePointer) null);
        if (sws == null || sws.isNull()) {
            throw new ConversionException("sws_getContext failed for pixel format " + frame.format());
        }

        int stride = width * 3;
        BytePointer pixels = new BytePointer((long) stride * height);
        PointerPointer<BytePointer> dstData = new PointerPointer<>(pixels);
        IntPointer dstStride = new IntPointer(stride);
        Frame bgr = new Frame(width, height, Frame.DEPTH_UBYTE, 3, stride);
        try {
            int rows = swscale.sws_scale(sws, frame.data(), frame.linesize(), 0, height, dstData, dstStride);
            if (rows != height) {
                throw new ConversionException("sws_scale produced " + rows + " of " + height + " rows");
            }

            ByteBuffer image = (ByteBuffer) bgr.image[0];
            image.put(pixels.asByteBuffer());
            image.rewind();

            // a new converter per call, its output image is not reused
            BufferedImage converted = new Java2DFrameConverter().convert(bgr);
            if (converted == null) {
                throw new ConversionException("Java2DFrameConverter returned no image");
            }
            return converted;
        } finally {
            bgr.close();
            swscale.sws_freeContext(sws);
            dstStride.close();
            dstData.close();
            pixels.close();
        }
    }

    @Override
    public void close() {
        if (frame != null) {
            avutil.av_frame_free(frame);
            frame = null;
        }
    }
}
