package com.camdecoder.camdecoder.service.codec.ffmpeg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Detects whether VAAPI decoding is likely to work on this host. The result is computed once.
 */
public class HardwareAccelerationProbe {

    private static final Logger logger = LoggerFactory.getLogger(HardwareAccelerationProbe.class);

    private static final List<Path> VAAPI_DEVICES = List.of(
            Paths.get("/dev/dri/renderD128"),
            Paths.get("/dev/dri/card0"));

    private static final long FFMPEG_TIMEOUT_SECONDS = 5;

    private final List<String> hwaccelCommand;
    private final long timeoutSeconds;

    private volatile Boolean available;
    private volatile String acceleratorType;

    public HardwareAccelerationProbe() {
        this(List.of("ffmpeg", "-hide_banner", "-hwaccels"), FFMPEG_TIMEOUT_SECONDS);
    }

    HardwareAccelerationProbe(List<String> hwaccelCommand, long timeoutSeconds) {
        this.hwaccelCommand = hwaccelCommand;
        this.timeoutSeconds = timeoutSeconds;
    }

    public boolean isAvailable() {
        Boolean result = available;
        if (result == null) {
            synchronized (this) {
                if (available == null) {
                    available = detect();
                }
                result = available;
            }
        }
        return result;
    }

    /**
     * @return "vaapi" when acceleration was detected, otherwise null
     */
    public String getAcceleratorType() {
        return isAvailable() ? acceleratorType : null;
    }

    boolean detect() {
        try {
            if (ffmpegListsVaapi()) {
                acceleratorType = "vaapi";
                logger.info("VAAPI hardware acceleration detected (via FFmpeg)");
                return true;
            }

            for (Path device : VAAPI_DEVICES) {
                if (Files.exists(device)) {
                    acceleratorType = "vaapi";
                    logger.info("VAAPI device {} detected, hardware acceleration may be available", device);
                    return true;
                }
            }

            logger.info("No VAAPI hardware acceleration available, will use software decoding");
            return false;
        } catch (RuntimeException e) {
            logger.warn("Failed to detect hardware acceleration: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Ask the ffmpeg binary for its hardware accelerators. Output goes to a temp file so a hung
     * process cannot block past the timeout.
     */
    boolean ffmpegListsVaapi() {
        Path output;
        try {
            output = Files.createTempFile("hwaccels", ".txt");
        } catch (IOException e) {
            logger.debug("Could not create temp file for hwaccel check: {}", e.getMessage());
            return false;
        }

        Process process = null;
        try {
            process = new ProcessBuilder(hwaccelCommand)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                logger.debug("{} did not finish within {}s", hwaccelCommand.get(0), timeoutSeconds);
                return false;
            }
            String listed = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            return process.exitValue() == 0 && listed.toLowerCase().contains("vaapi");
        } catch (IOException e) {
            logger.debug("ffmpeg command not found for hwaccel check");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                logger.debug("Could not delete {}: {}", output, e.getMessage());
            }
        }
    }
}
