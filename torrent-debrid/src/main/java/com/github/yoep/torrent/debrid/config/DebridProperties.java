package com.github.yoep.torrent.debrid.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties("popcorn.debrid")
public class DebridProperties {
    /**
     * The base url of the Real-Debrid REST API.
     */
    @NotNull
    private URI url = URI.create("https://api.real-debrid.com/rest/1.0");

    /**
     * The private API access token.
     * The unlock service is disabled when no token is configured.
     */
    private String token;

    /**
     * The connect timeout of a single request to the API.
     */
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * The read timeout of a single request to the API.
     */
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(45);

    /**
     * The max. duration of a complete stream resolution, including all polling.
     */
    @NotNull
    private Duration resolveTimeout = Duration.ofSeconds(120);

    /**
     * Check if an access token has been configured.
     *
     * @return Returns true when the token is not blank.
     */
    public boolean isEnabled() {
        return StringUtils.isNotBlank(token);
    }

    /**
     * Get the configured token without any surrounding whitespace.
     *
     * @return Returns the trimmed token, or an empty string when not configured.
     */
    public String getTrimmedToken() {
        return StringUtils.trimToEmpty(token);
    }
}
