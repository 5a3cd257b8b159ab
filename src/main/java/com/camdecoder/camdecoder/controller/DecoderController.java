package com.camdecoder.camdecoder.controller;

import com.camdecoder.camdecoder.model.DecoderStatus;
import com.camdecoder.camdecoder.service.decoder.MediaDecoderService;
import com.camdecoder.camdecoder.service.sink.SnapshotStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Decoder Controller
 *
 * Endpoints:
 * - POST /decoder/start/{cameraId} - Start decoding frames for a camera
 * - POST /decoder/stop/{cameraId} - Stop decoding for a camera
 * - GET /decoder/status - Status of every decoder
 * - GET /decoder/{cameraId}/snapshot - Latest JPEG snapshot
 */
@RestController
@RequestMapping("/decoder")
@CrossOrigin(origins = "*")
public class DecoderController {

    @Autowired
    private MediaDecoderService decoderService;

    @Autowired
    private SnapshotStore snapshotStore;

    @PostMapping("/start/{cameraId}")
    public ResponseEntity<Map<String, String>> startDecoder(@PathVariable String cameraId) {
        if (cameraId == null || cameraId.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Camera id cannot be null or empty"));
        }
        String sanitized = sanitize(cameraId);

        if (!decoderService.startDecoder(sanitized)) {
            return ResponseEntity.ok(Map.of("message", "Decoder already running: " + sanitized));
        }
        return ResponseEntity.ok(Map.of("message", "Decoder started: " + sanitized));
    }

    @PostMapping("/stop/{cameraId}")
    public ResponseEntity<Map<String, String>> stopDecoder(@PathVariable String cameraId) {
        if (cameraId == null || cameraId.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Camera id cannot be null or empty"));
        }
        String sanitized = sanitize(cameraId);

        if (!decoderService.stopDecoder(sanitized)) {
            return ResponseEntity.status(404).body(Map.of("error", "No active decoder for camera: " + sanitized));
        }
        return ResponseEntity.ok(Map.of("message", "Decoder stopped: " + sanitized));
    }

    @GetMapping("/status")
    public Map<String, DecoderStatus> getStatus() {
        return decoderService.getDecoderStatus();
    }

    @GetMapping(value = "/{cameraId}/snapshot", produces = MediaType.IMAGE_JPEG_VALUE)
    public ResponseEntity<byte[]> getSnapshot(@PathVariable String cameraId) {
        SnapshotStore.MediaSample snapshot = snapshotStore.getLatestSnapshot(sanitize(cameraId));
        if (snapshot == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_JPEG)
                .header("X-Frame-Timestamp", String.valueOf(snapshot.getTimestamp()))
                .header("X-Frame-Channel", String.valueOf(snapshot.getChannel()))
                .body(snapshot.getData());
    }

    // ids end up in log lines and map keys, keep them to a safe alphabet
    private static String sanitize(String cameraId) {
        return cameraId.replaceAll("[^a-zA-Z0-9_-]", "_");
    }
}
