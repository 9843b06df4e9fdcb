package com.github.yoep.torrent.debrid.polling;

import org.springframework.util.Assert;

import java.time.Duration;

/**
 * The budget of a polling loop.
 *
 * @param attempts The max. number of attempts.
 * @param interval The wait between two attempts.
 */
public record PollingPolicy(int attempts, Duration interval) {
    /**
     * Reading the file manifest of a torrent is fast, ~9.6 seconds in total.
     */
    public static final PollingPolicy METADATA = new PollingPolicy(8, Duration.ofMillis(1200));
    /**
     * Caching the content of the selected file is slow and variable, ~45 seconds in total.
     */
    public static final PollingPolicy READY_LINKS = new PollingPolicy(30, Duration.ofMillis(1500));

    public PollingPolicy {
        Assert.isTrue(attempts > 0, "attempts must be larger than 0");
        Assert.notNull(interval, "interval cannot be null");
    }
}
