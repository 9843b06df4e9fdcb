package com.github.yoep.torrent.adapter;

/**
 * Exception indicating that the unlock service accepted the magnet but returned no torrent id.
 */
public class EmptyHandleException extends UnlockException {
    public EmptyHandleException() {
        super("Unlock service returned an empty torrent id");
    }
}
