package com.github.yoep.popcorn.backend.config;

import com.github.yoep.popcorn.backend.config.properties.PopcornProperties;
import com.github.yoep.popcorn.backend.media.providers.CatalogProviderService;
import com.github.yoep.popcorn.backend.media.providers.StreamProviderService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

@Configuration
public class MediaConfig {
    @Bean
    public CatalogProviderService catalogProviderService(RestTemplate restTemplate,
                                                         PopcornProperties properties,
                                                         ThreadPoolTaskExecutor taskExecutor) {
        return new CatalogProviderService(restTemplate, properties.getProvider(PopcornProperties.CATALOG_PROVIDER), taskExecutor);
    }

    @Bean
    public StreamProviderService streamProviderService(RestTemplate restTemplate,
                                                       PopcornProperties properties,
                                                       ThreadPoolTaskExecutor taskExecutor) {
        return new StreamProviderService(restTemplate, properties.getProvider(PopcornProperties.STREAMS_PROVIDER), taskExecutor);
    }
}
