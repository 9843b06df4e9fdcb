package com.github.yoep.popcorn.backend.stream;

import org.springframework.util.Assert;

/**
 * The playable outcome of resolving a stream descriptor.
 *
 * @param url    The url which should be handed to the player.
 * @param status The way the url has been obtained.
 */
public record ResolvedStream(String url, ResolveStatus status) {
    public ResolvedStream {
        Assert.hasText(url, "url cannot be empty");
        Assert.notNull(status, "status cannot be null");
    }

    public static ResolvedStream passthrough(String url) {
        return new ResolvedStream(url, ResolveStatus.PASSTHROUGH);
    }

    public static ResolvedStream unlocked(String url) {
        return new ResolvedStream(url, ResolveStatus.UNLOCKED);
    }

    public static ResolvedStream fallback(String url) {
        return new ResolvedStream(url, ResolveStatus.FALLBACK);
    }

    public static ResolvedStream cancelled(String url) {
        return new ResolvedStream(url, ResolveStatus.CANCELLED);
    }
}
