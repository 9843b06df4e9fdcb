package com.github.yoep.torrent.adapter;

import lombok.Getter;

import java.text.MessageFormat;

/**
 * Exception indicating that the stream descriptor carries neither a url nor an info hash.
 * This is the only failure of a resolution that is never replaced by a fallback.
 */
@Getter
public class NoPlayableSourceException extends StreamException {
    /**
     * The display name of the stream which couldn't be played.
     */
    private final String name;

    public NoPlayableSourceException(String name) {
        super(MessageFormat.format("Stream \"{0}\" does not include a playable url", name));
        this.name = name;
    }
}
