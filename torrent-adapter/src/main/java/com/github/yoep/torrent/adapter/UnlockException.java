package com.github.yoep.torrent.adapter;

/**
 * Exception indicating that a step of the remote unlock process failed.
 */
public class UnlockException extends TorrentException {
    public UnlockException(String message) {
        super(message);
    }

    public UnlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
