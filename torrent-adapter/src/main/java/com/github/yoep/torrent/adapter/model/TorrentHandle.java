package com.github.yoep.torrent.adapter.model;

import org.springframework.util.Assert;

/**
 * The handle of a torrent which has been registered within the unlock service.
 * A handle is only valid for the resolution attempt which created it.
 *
 * @param id The opaque id assigned by the unlock service.
 */
public record TorrentHandle(String id) {
    public TorrentHandle {
        Assert.hasText(id, "id cannot be empty");
    }
}
