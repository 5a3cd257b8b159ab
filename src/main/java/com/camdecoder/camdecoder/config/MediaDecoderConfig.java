package com.camdecoder.camdecoder.config;

import com.camdecoder.camdecoder.service.codec.CodecFactory;
import com.camdecoder.camdecoder.service.codec.ImageEncoder;
import com.camdecoder.camdecoder.service.codec.JpegImageEncoder;
import com.camdecoder.camdecoder.service.codec.ffmpeg.FfmpegCodecFactory;
import com.camdecoder.camdecoder.service.codec.ffmpeg.HardwareAccelerationProbe;
import com.camdecoder.camdecoder.service.decoder.CrossContextDispatcher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(CameraProperties.class)
public class MediaDecoderConfig {

    /**
     * Single thread on which every decoded payload is delivered, in submission order
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService mediaCallbackExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "camera-callback");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public CrossContextDispatcher crossContextDispatcher(ExecutorService mediaCallbackExecutor) {
        return new CrossContextDispatcher(mediaCallbackExecutor);
    }

    @Bean
    public HardwareAccelerationProbe hardwareAccelerationProbe() {
        return new HardwareAccelerationProbe();
    }

    @Bean
    public CodecFactory codecFactory(CameraProperties properties, HardwareAccelerationProbe probe) {
        return new FfmpegCodecFactory(properties.isEnableHwAccel(), probe);
    }

    @Bean
    public ImageEncoder imageEncoder() {
        return new JpegImageEncoder();
    }
}
