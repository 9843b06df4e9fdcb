package com.github.yoep.popcorn.backend.media.providers;

import lombok.Getter;

import java.net.URI;

/**
 * Indicates that the response of a provider API could not be mapped onto the expected payload.
 */
@Getter
public class MediaParsingException extends MediaException {
    private final URI uri;

    public MediaParsingException(URI uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }
}
