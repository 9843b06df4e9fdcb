package com.github.yoep.torrent.adapter.model;

import org.springframework.util.Assert;

/**
 * A link issued by the unlock service once the selected torrent content is available.
 *
 * @param url The restricted link which still needs to be unrestricted.
 */
public record ReadyLink(String url) {
    public ReadyLink {
        Assert.hasText(url, "url cannot be empty");
    }
}
