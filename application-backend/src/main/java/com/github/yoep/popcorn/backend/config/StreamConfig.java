package com.github.yoep.popcorn.backend.config;

import com.github.yoep.popcorn.backend.stream.StreamResolverService;
import com.github.yoep.torrent.adapter.UnlockService;
import com.github.yoep.torrent.debrid.config.DebridProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class StreamConfig {
    @Bean
    public StreamResolverService streamResolverService(UnlockService unlockService,
                                                       ThreadPoolTaskExecutor taskExecutor,
                                                       DebridProperties debridProperties) {
        return new StreamResolverService(unlockService, taskExecutor, debridProperties.getResolveTimeout());
    }
}
