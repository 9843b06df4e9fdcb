package com.github.yoep.torrent.adapter;

/**
 * Exception indicating that the unlock process has been cancelled by interrupting the invoking thread.
 */
public class UnlockCancelledException extends UnlockException {
    public UnlockCancelledException(String message) {
        super(message);
    }

    public UnlockCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
