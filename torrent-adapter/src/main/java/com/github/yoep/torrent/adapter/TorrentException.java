package com.github.yoep.torrent.adapter;

/**
 * Exception indicating that an error occurred while resolving or unlocking a torrent.
 */
public class TorrentException extends RuntimeException {
    public TorrentException(String message) {
        super(message);
    }

    public TorrentException(String message, Throwable cause) {
        super(message, cause);
    }
}
