package com.github.yoep.torrent.adapter;

import java.text.MessageFormat;

/**
 * Exception indicating that the unlock service didn't expose any ready link within the polling budget.
 */
public class LinksTimeoutException extends UnlockException {
    public LinksTimeoutException(String torrentId, int attempts) {
        super(MessageFormat.format("Timeout waiting for links of torrent {0} after {1} attempts", torrentId, attempts));
    }
}
