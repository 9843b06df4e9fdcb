package com.github.yoep.torrent.debrid.config;

import com.github.yoep.torrent.adapter.UnlockService;
import com.github.yoep.torrent.debrid.DebridUnlockService;
import com.github.yoep.torrent.debrid.polling.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Configuration
public class DebridConfig {
    @Bean
    public RestTemplate debridRestTemplate(DebridProperties properties) {
        log.debug("Creating debrid rest template for {}", properties.getUrl());
        return new RestTemplateBuilder()
                .rootUri(properties.getUrl().toString())
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getTrimmedToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .errorHandler(new DebridResponseErrorHandler())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper unlockSleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    @ConditionalOnMissingBean(UnlockService.class)
    public UnlockService unlockService(@Qualifier("debridRestTemplate") RestTemplate debridRestTemplate, DebridProperties properties, Sleeper unlockSleeper) {
        if (!properties.isEnabled()) {
            log.info("No debrid access token has been configured, streams will be played without unlocking");
        }

        return new DebridUnlockService(debridRestTemplate, properties, unlockSleeper);
    }
}
