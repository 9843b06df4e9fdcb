package com.github.yoep.popcorn.backend.media.providers;

import lombok.Getter;

import java.net.URI;
import java.text.MessageFormat;

/**
 * Indicates that a provider API could not be reached or answered with a non-successful status.
 */
@Getter
public class MediaRetrievalException extends MediaException {
    /**
     * The status used when no response has been received from the API.
     */
    public static final int NO_RESPONSE = 0;

    private final URI uri;
    private final int status;

    public MediaRetrievalException(URI uri, int status, String message, Throwable cause) {
        super(MessageFormat.format("Request {0} failed ({1}): {2}", uri, status, message), cause);
        this.uri = uri;
        this.status = status;
    }
}
