package com.github.yoep.popcorn.backend.playback;

import com.github.yoep.popcorn.backend.adapters.player.PlayRequest;
import com.github.yoep.popcorn.backend.adapters.player.PlayerService;
import com.github.yoep.popcorn.backend.stream.ResolvedStream;
import com.github.yoep.popcorn.backend.stream.StreamResolverService;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.Assert;

import java.util.concurrent.CompletableFuture;

@Slf4j
@RequiredArgsConstructor
public class PlaybackService {
    private final StreamResolverService resolverService;
    private final PlayerService playerService;

    /**
     * Resolve the given stream and start its playback.
     *
     * @param title      The title of the media which is being played.
     * @param descriptor The stream to play.
     * @return Returns the resolved stream which has been handed to the player.
     */
    public CompletableFuture<ResolvedStream> play(String title, StreamDescriptor descriptor) {
        Assert.notNull(descriptor, "descriptor cannot be null");
        var name = StringUtils.defaultIfBlank(title, descriptor.getDisplayName());

        return resolverService.resolveAsync(descriptor)
                .thenApply(stream -> {
                    log.debug("Stream of \"{}\" has been resolved with status {}", name, stream.status());
                    playerService.play(PlayRequest.builder()
                            .url(stream.url())
                            .title(name)
                            .build());
                    return stream;
                });
    }
}
