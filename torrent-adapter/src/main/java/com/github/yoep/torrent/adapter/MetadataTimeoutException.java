package com.github.yoep.torrent.adapter;

import java.text.MessageFormat;

/**
 * Exception indicating that the torrent file manifest didn't become available within the polling budget.
 */
public class MetadataTimeoutException extends UnlockException {
    public MetadataTimeoutException(String torrentId, int attempts) {
        super(MessageFormat.format("Torrent {0} metadata did not become available after {1} attempts", torrentId, attempts));
    }
}
