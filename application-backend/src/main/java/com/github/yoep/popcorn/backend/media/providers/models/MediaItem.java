package com.github.yoep.popcorn.backend.media.providers.models;

import lombok.Builder;
import lombok.Value;

/**
 * A movie or series entry of the media catalog.
 */
@Value
@Builder
public class MediaItem {
    /**
     * The IMDB identifier of the media item.
     */
    String id;
    String name;
    MediaType type;
    /**
     * The release year, or 0 when unknown.
     */
    int year;
    String poster;

    public boolean isSeries() {
        return type == MediaType.SERIES;
    }
}
