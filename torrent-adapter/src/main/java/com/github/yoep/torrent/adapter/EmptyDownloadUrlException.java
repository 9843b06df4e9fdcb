package com.github.yoep.torrent.adapter;

import java.text.MessageFormat;

/**
 * Exception indicating that the unrestrict response didn't contain a download url.
 */
public class EmptyDownloadUrlException extends UnlockException {
    public EmptyDownloadUrlException(String link) {
        super(MessageFormat.format("Unlock service returned an empty download link for \"{0}\"", link));
    }
}
