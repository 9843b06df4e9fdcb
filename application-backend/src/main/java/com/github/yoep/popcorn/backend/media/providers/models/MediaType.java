package com.github.yoep.popcorn.backend.media.providers.models;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum MediaType {
    MOVIE("movie"),
    SERIES("series"),
    UNKNOWN("unknown");

    /**
     * The key of the media type as used by the provider APIs.
     */
    private final String key;

    /**
     * Get the media type for the given key.
     *
     * @param key The API key of the media type.
     * @return Returns the media type, or {@link #UNKNOWN} when the key is not supported.
     */
    public static MediaType fromKey(String key) {
        return Arrays.stream(values())
                .filter(e -> e != UNKNOWN && e.getKey().equalsIgnoreCase(key))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
