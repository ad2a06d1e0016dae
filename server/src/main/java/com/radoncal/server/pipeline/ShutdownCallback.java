package com.radoncal.server.pipeline;

/**
 * Invoked once when a host's loop ends, whether it ran out of work or was
 * told to stop.
 */
@FunctionalInterface
public interface ShutdownCallback {
    void onShutdown(String hostId);
}
