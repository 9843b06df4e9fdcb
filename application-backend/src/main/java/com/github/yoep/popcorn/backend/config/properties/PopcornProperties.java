package com.github.yoep.popcorn.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties("popcorn")
public class PopcornProperties {
    public static final String CATALOG_PROVIDER = "catalog";
    public static final String STREAMS_PROVIDER = "streams";

    /**
     * The metadata providers, keyed by their name.
     */
    @Valid
    @NotNull
    private Map<String, ProviderProperties> providers = new HashMap<>();

    /**
     * The external player which plays the resolved streams.
     */
    @Valid
    @NotNull
    private PlayerProperties player = new PlayerProperties();

    /**
     * The connect and read timeout of a single provider request.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(20);

    public ProviderProperties getProvider(String name) {
        return providers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .findFirst()
                .map(Map.Entry::getValue)
                .orElseThrow(() -> new ProviderNotFoundException(name));
    }
}
