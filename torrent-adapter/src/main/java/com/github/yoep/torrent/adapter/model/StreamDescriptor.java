package com.github.yoep.torrent.adapter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * A playback candidate as discovered by a stream indexer, before it has been resolved.
 */
@Value
@Builder
public class StreamDescriptor {
    /**
     * The short name of the stream as shown by the indexer.
     */
    String displayName;
    /**
     * The descriptive title of the stream, most of the time containing the release name.
     */
    String title;
    /**
     * The raw url of the stream, which might be a direct http url, a magnet uri or empty.
     */
    String rawUrl;
    /**
     * The info hash of the torrent swarm, if known.
     */
    String infoHash;
    /**
     * The 0-based index of the file within the torrent which should be played, if known.
     */
    Integer explicitFileIndex;
    /**
     * The ordered sources of the stream, trackers are prefixed with "tracker:".
     */
    @Singular
    List<String> sources;

    public String getRawUrl() {
        return StringUtils.defaultString(rawUrl);
    }

    public String getInfoHash() {
        return StringUtils.defaultString(infoHash);
    }

    public Optional<Integer> getExplicitFileIndex() {
        return Optional.ofNullable(explicitFileIndex);
    }

    /**
     * Check if this descriptor carries anything that might be resolved into a playable url.
     *
     * @return Returns true when the descriptor has a raw url or an info hash.
     */
    public boolean isResolvable() {
        return StringUtils.isNotEmpty(rawUrl) || StringUtils.isNotEmpty(infoHash);
    }
}
