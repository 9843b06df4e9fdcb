package com.github.yoep.popcorn.backend.adapters.player;

/**
 * The player service hands resolved streams over to a media player.
 */
public interface PlayerService {
    /**
     * Start the playback of the given request.
     *
     * @param request The request to play.
     * @throws PlayerException Is thrown when the player failed to start the playback.
     */
    void play(PlayRequest request);
}
