package com.github.yoep.torrent.adapter;

/**
 * Exception indicating that no valid torrent file could be selected for unlocking.
 */
public class InvalidSelectionException extends UnlockException {
    public InvalidSelectionException(String message) {
        super(message);
    }
}
