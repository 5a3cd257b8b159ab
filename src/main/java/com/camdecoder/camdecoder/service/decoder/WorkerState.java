package com.camdecoder.camdecoder.service.decoder;

public enum WorkerState {
    CREATED,
    RUNNING,
    STOPPING,
    STOPPED
}
