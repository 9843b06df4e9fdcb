package com.github.yoep.popcorn.backend.config;

import com.github.yoep.popcorn.backend.cli.PopcornCommandLineRunner;
import com.github.yoep.popcorn.backend.media.providers.CatalogProviderService;
import com.github.yoep.popcorn.backend.media.providers.StreamProviderService;
import com.github.yoep.popcorn.backend.playback.PlaybackService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CliConfig {
    @Bean
    public PopcornCommandLineRunner popcornCommandLineRunner(CatalogProviderService catalogProviderService,
                                                             StreamProviderService streamProviderService,
                                                             PlaybackService playbackService) {
        return new PopcornCommandLineRunner(catalogProviderService, streamProviderService, playbackService, System.out);
    }
}
