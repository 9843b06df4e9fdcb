package com.github.yoep.torrent.adapter;

import com.github.yoep.torrent.adapter.model.PlayableReference;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.Assert;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies a {@link StreamDescriptor} into a canonical {@link PlayableReference}.
 * The classification is side-effect free, normalizing the same descriptor twice results in the same reference.
 */
public final class DescriptorNormalizer {
    static final String HTTP_PREFIX = "http";
    static final String MAGNET_PREFIX = "magnet:";
    static final String MAGNET_HASH_PREFIX = "magnet:?xt=urn:btih:";
    static final String TRACKER_PARAM = "&tr=";
    static final String TRACKER_SOURCE_PREFIX = "tracker:";

    private DescriptorNormalizer() {
    }

    /**
     * Normalize the given stream descriptor.
     *
     * @param descriptor The descriptor to classify.
     * @return Returns the playable reference of the descriptor.
     */
    public static PlayableReference normalize(StreamDescriptor descriptor) {
        Assert.notNull(descriptor, "descriptor cannot be null");
        var rawUrl = descriptor.getRawUrl();

        if (StringUtils.startsWithIgnoreCase(rawUrl, HTTP_PREFIX)) {
            return PlayableReference.directUrl(rawUrl);
        }
        if (StringUtils.startsWithIgnoreCase(rawUrl, MAGNET_PREFIX)) {
            return PlayableReference.magnetUri(rawUrl);
        }

        return PlayableReference.hashSynthesized(buildMagnet(descriptor.getInfoHash(), descriptor.getSources()));
    }

    /**
     * Build a magnet uri for the given info hash.
     * Each distinct tracker source is added once, in the order it was first seen.
     *
     * @param infoHash The info hash of the torrent.
     * @param sources  The sources of the stream, only the ones prefixed with "tracker:" are used.
     * @return Returns the magnet uri, or an empty string when the info hash is empty.
     */
    public static String buildMagnet(String infoHash, List<String> sources) {
        if (StringUtils.isEmpty(infoHash)) {
            return StringUtils.EMPTY;
        }

        var magnet = new StringBuilder(MAGNET_HASH_PREFIX)
                .append(infoHash.toLowerCase(Locale.ROOT));

        for (var tracker : trackersOf(sources)) {
            magnet.append(TRACKER_PARAM)
                    .append(encodeTracker(tracker));
        }

        return magnet.toString();
    }

    // query escaping keeps "~" and escapes "*", unlike the form encoding of URLEncoder
    private static String encodeTracker(String tracker) {
        return URLEncoder.encode(tracker, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static Set<String> trackersOf(List<String> sources) {
        var trackers = new LinkedHashSet<String>();

        if (sources == null) {
            return trackers;
        }

        for (var source : sources) {
            if (!StringUtils.startsWith(source, TRACKER_SOURCE_PREFIX)) {
                continue;
            }

            var tracker = source.substring(TRACKER_SOURCE_PREFIX.length()).trim();
            if (!tracker.isEmpty()) {
                trackers.add(tracker);
            }
        }

        return trackers;
    }
}
