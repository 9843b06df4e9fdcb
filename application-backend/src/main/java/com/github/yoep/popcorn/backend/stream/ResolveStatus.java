package com.github.yoep.popcorn.backend.stream;

/**
 * The way a {@link ResolvedStream} has been obtained.
 */
public enum ResolveStatus {
    /**
     * The stream url is used as is, the unlock service is not enabled.
     */
    PASSTHROUGH,
    /**
     * The stream url has been unlocked into a direct download url.
     */
    UNLOCKED,
    /**
     * The unlock service failed and the original url is used instead.
     */
    FALLBACK,
    /**
     * The resolution has been cancelled and the original url is used instead.
     */
    CANCELLED
}
