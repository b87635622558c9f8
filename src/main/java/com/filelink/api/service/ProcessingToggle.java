package com.filelink.api.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide pause switch. Written by admin moderation, read by the command guard.
 */
@Component
public class ProcessingToggle {

    private final AtomicBoolean paused = new AtomicBoolean(false);

    /**
     * @return true if this call changed the state
     */
    public boolean pause() {
        return paused.compareAndSet(false, true);
    }

    public boolean resume() {
        return paused.compareAndSet(true, false);
    }

    public boolean isPaused() {
        return paused.get();
    }
}
