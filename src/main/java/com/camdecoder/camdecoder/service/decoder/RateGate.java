package com.camdecoder.camdecoder.service.decoder;

/**
 * Limits how often decoded video is forwarded. Each tick that is let through moves the gate
 * forward, whether or not the tick produced a picture.
 *
 * Only the decode thread uses an instance, so it is not synchronized.
 */
public class RateGate {

    private final long intervalMs;
    private long lastEmitTimestamp = 0L;

    public RateGate(long intervalMs) {
        this.intervalMs = Math.max(0L, intervalMs);
    }

    public boolean isOpen(long nowMs) {
        return nowMs - lastEmitTimestamp >= intervalMs;
    }

    /**
     * Claim the current tick.
     *
     * @return true if the interval has elapsed; the gate is then closed until {@code nowMs + interval}
     */
    public boolean tryAcquire(long nowMs) {
        if (!isOpen(nowMs)) {
            return false;
        }
        lastEmitTimestamp = nowMs;
        return true;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getLastEmitTimestamp() {
        return lastEmitTimestamp;
    }
}
