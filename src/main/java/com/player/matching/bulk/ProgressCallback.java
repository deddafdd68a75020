package com.player.matching.bulk;

/**
 * Receives progress while player files are loaded or match reports are written.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed rows handled so far
     * @param total     rows expected, or -1 while a streaming import cannot know it yet
     * @param message   short human-readable status
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
