package com.github.yoep.popcorn.backend.media.providers;

import com.github.yoep.popcorn.backend.config.properties.ProviderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.Assert;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.client.UnknownContentTypeException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * Base implementation for the providers which retrieve their information from a JSON API.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractProviderService {
    static final int MAX_ERROR_BODY_LENGTH = 2048;

    protected final RestTemplate restTemplate;
    protected final ProviderProperties properties;

    /**
     * Create the uri for the given path template of this provider.
     *
     * @param path      The path template, relative to the provider base url.
     * @param variables The values of the path template variables, which will be encoded.
     * @return Returns the expanded uri.
     */
    protected URI getUriFor(String path, Object... variables) {
        Assert.notNull(properties.getUrl(), "provider url has not been configured");
        return UriComponentsBuilder.fromUri(properties.getUrl())
                .path(path)
                .encode()
                .buildAndExpand(variables)
                .toUri();
    }

    /**
     * Retrieve the given uri and map the response onto the given type.
     *
     * @param uri          The uri to retrieve.
     * @param responseType The expected response payload.
     * @param <T>          The payload type.
     * @return Returns the payload if one was present, else {@link Optional#empty()}.
     * @throws MediaRetrievalException Is thrown when the API could not be reached or returned an error status.
     * @throws MediaParsingException   Is thrown when the API response is invalid.
     */
    protected <T> Optional<T> get(URI uri, Class<T> responseType) {
        log.trace("Retrieving provider resource {}", uri);
        try {
            return Optional.ofNullable(restTemplate.getForObject(uri, responseType));
        } catch (HttpStatusCodeException ex) {
            var body = StringUtils.truncate(StringUtils.trim(ex.getResponseBodyAsString()), MAX_ERROR_BODY_LENGTH);
            log.warn("Provider request {} failed with status {}", uri, ex.getRawStatusCode());
            throw new MediaRetrievalException(uri, ex.getRawStatusCode(), body, ex);
        } catch (RestClientException ex) {
            if (ex.getCause() instanceof HttpMessageNotReadableException || ex instanceof UnknownContentTypeException) {
                log.error("Failed to parse API response, {}", ex.getMessage(), ex);
                throw new MediaParsingException(uri, "Failed to parse API response", ex);
            }

            log.warn("Provider request {} failed, {}", uri, ex.getMessage());
            throw new MediaRetrievalException(uri, MediaRetrievalException.NO_RESPONSE, ex.getMessage(), ex);
        }
    }
}
