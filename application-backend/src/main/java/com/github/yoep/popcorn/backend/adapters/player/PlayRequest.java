package com.github.yoep.popcorn.backend.adapters.player;

import lombok.Builder;
import lombok.Value;

/**
 * A request to start the playback of a url within a player.
 */
@Value
@Builder
public class PlayRequest {
    /**
     * The playable url of the stream.
     */
    String url;
    /**
     * The title of the media which is being played.
     */
    String title;
}
