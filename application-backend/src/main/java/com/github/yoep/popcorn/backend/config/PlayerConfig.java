package com.github.yoep.popcorn.backend.config;

import com.github.yoep.popcorn.backend.adapters.player.PlayerService;
import com.github.yoep.popcorn.backend.config.properties.PopcornProperties;
import com.github.yoep.popcorn.backend.playback.PlaybackService;
import com.github.yoep.popcorn.backend.player.ExternalPlayerService;
import com.github.yoep.popcorn.backend.stream.StreamResolverService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlayerConfig {
    @Bean
    @ConditionalOnMissingBean(PlayerService.class)
    public PlayerService playerService(PopcornProperties properties) {
        return new ExternalPlayerService(properties.getPlayer());
    }

    @Bean
    public PlaybackService playbackService(StreamResolverService streamResolverService, PlayerService playerService) {
        return new PlaybackService(streamResolverService, playerService);
    }
}
