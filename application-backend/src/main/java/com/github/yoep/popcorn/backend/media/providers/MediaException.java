package com.github.yoep.popcorn.backend.media.providers;

/**
 * Base exception for all failures of the media metadata providers.
 */
public class MediaException extends RuntimeException {
    public MediaException(String message) {
        super(message);
    }

    public MediaException(String message, Throwable cause) {
        super(message, cause);
    }
}
