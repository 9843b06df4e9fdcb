package com.github.yoep.torrent.adapter;

/**
 * Exception indicating that a stream descriptor could not be turned into a playable stream.
 */
public class StreamException extends RuntimeException {
    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
