package com.github.yoep.torrent.adapter.model;

import lombok.Builder;
import lombok.Value;

/**
 * A file within the manifest of a torrent as reported by the unlock service.
 */
@Value
@Builder
public class TorrentFile {
    /**
     * The id the unlock service uses when no file is available.
     */
    public static final int NONE = 0;

    /**
     * The 0-based position of the file within the manifest.
     */
    int index;
    /**
     * The id assigned by the unlock service, starting at 1.
     */
    int id;
    /**
     * The path of the file within the torrent.
     */
    String path;
    /**
     * The size of the file in bytes.
     */
    long size;
}
