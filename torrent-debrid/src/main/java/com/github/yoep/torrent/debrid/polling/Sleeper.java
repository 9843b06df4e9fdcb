package com.github.yoep.torrent.debrid.polling;

import java.time.Duration;

/**
 * Pauses the invoking thread between two polling attempts.
 */
@FunctionalInterface
public interface Sleeper {
    /**
     * The sleeper which blocks the current thread.
     */
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    /**
     * Sleep for the given duration.
     *
     * @param duration The duration to sleep.
     * @throws InterruptedException Is thrown when the thread is interrupted while sleeping.
     */
    void sleep(Duration duration) throws InterruptedException;
}
