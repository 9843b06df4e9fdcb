package com.github.yoep.torrent.adapter.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * The classified, canonical reference of a {@link StreamDescriptor}.
 *
 * @param kind The kind of reference.
 * @param url  The direct url or magnet uri, empty when a magnet couldn't be synthesized.
 */
public record PlayableReference(Kind kind, String url) {
    public PlayableReference {
        Objects.requireNonNull(kind, "kind cannot be null");
        url = StringUtils.defaultString(url);
    }

    public static PlayableReference directUrl(String url) {
        return new PlayableReference(Kind.DIRECT_URL, url);
    }

    public static PlayableReference magnetUri(String magnet) {
        return new PlayableReference(Kind.MAGNET_URI, magnet);
    }

    public static PlayableReference hashSynthesized(String magnet) {
        return new PlayableReference(Kind.HASH_SYNTHESIZED, magnet);
    }

    /**
     * Check if this reference points to an actual url or magnet.
     *
     * @return Returns true when the url is not empty.
     */
    public boolean isAvailable() {
        return !url.isEmpty();
    }

    public enum Kind {
        /**
         * A http(s) url which can be played without any transformation.
         */
        DIRECT_URL,
        /**
         * A magnet uri which has been provided as is.
         */
        MAGNET_URI,
        /**
         * A magnet uri which has been built from the info hash and tracker sources.
         */
        HASH_SYNTHESIZED
    }
}
