package com.github.yoep.popcorn.backend.media.providers.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The top entries of the movie and series catalogs.
 */
@Value
@Builder
public class PopularMedia {
    List<MediaItem> movies;
    List<MediaItem> series;
}
