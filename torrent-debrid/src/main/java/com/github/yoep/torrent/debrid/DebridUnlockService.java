package com.github.yoep.torrent.debrid;

import com.github.yoep.torrent.adapter.*;
import com.github.yoep.torrent.adapter.model.TorrentHandle;
import com.github.yoep.torrent.debrid.config.DebridProperties;
import com.github.yoep.torrent.debrid.model.AddMagnetResponse;
import com.github.yoep.torrent.debrid.model.TorrentInfoResponse;
import com.github.yoep.torrent.debrid.model.UnrestrictResponse;
import com.github.yoep.torrent.debrid.polling.Poller;
import com.github.yoep.torrent.debrid.polling.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Real-Debrid implementation of the {@link UnlockService}.
 * This service holds no state of its own, each registered torrent is tracked by its {@link DebridUnlockSession}.
 */
@Slf4j
public class DebridUnlockService implements UnlockService {
    static final String ADD_MAGNET_PATH = "/torrents/addMagnet";
    static final String INFO_PATH = "/torrents/info/{id}";
    static final String SELECT_FILES_PATH = "/torrents/selectFiles/{id}";
    static final String UNRESTRICT_PATH = "/unrestrict/link";
    /**
     * The max. number of characters kept from an error response body.
     */
    static final int MAX_ERROR_BODY_LENGTH = 2048;

    private final RestTemplate restTemplate;
    private final DebridProperties properties;
    private final Poller poller;

    public DebridUnlockService(RestTemplate restTemplate, DebridProperties properties, Sleeper sleeper) {
        Assert.notNull(restTemplate, "restTemplate cannot be null");
        Assert.notNull(properties, "properties cannot be null");
        Assert.notNull(sleeper, "sleeper cannot be null");
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.poller = new Poller(sleeper);
    }

    //region UnlockService

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public UnlockSession register(String magnet) {
        Assert.hasText(magnet, "magnet cannot be empty");
        log.debug("Registering magnet {}", magnet);
        var response = execute(() -> restTemplate.postForObject(ADD_MAGNET_PATH, form("magnet", magnet), AddMagnetResponse.class));
        var id = Optional.ofNullable(response)
                .map(AddMagnetResponse::getId)
                .filter(StringUtils::isNotBlank)
                .orElseThrow(EmptyHandleException::new);

        log.debug("Magnet has been registered as torrent {}", id);
        return new DebridUnlockSession(this, new TorrentHandle(id));
    }

    @Override
    public String unrestrict(String link) {
        Assert.hasText(link, "link cannot be empty");
        log.debug("Unrestricting link {}", link);
        var response = execute(() -> restTemplate.postForObject(UNRESTRICT_PATH, form("link", link), UnrestrictResponse.class));

        return Optional.ofNullable(response)
                .map(UnrestrictResponse::getDownload)
                .filter(StringUtils::isNotBlank)
                .orElseThrow(() -> new EmptyDownloadUrlException(link));
    }

    //endregion

    //region Functions

    Poller getPoller() {
        return poller;
    }

    TorrentInfoResponse info(TorrentHandle handle) {
        var response = execute(() -> restTemplate.getForObject(INFO_PATH, TorrentInfoResponse.class, handle.id()));

        return Optional.ofNullable(response)
                .orElseGet(TorrentInfoResponse::new);
    }

    void selectFiles(TorrentHandle handle, int... fileIds) {
        var files = IntStream.of(fileIds)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining(","));

        log.debug("Selecting files {} of torrent {}", files, handle.id());
        execute(() -> restTemplate.postForEntity(SELECT_FILES_PATH, form("files", files), Void.class, handle.id()));
    }

    private <T> T execute(Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException ex) {
            var body = StringUtils.left(StringUtils.trimToEmpty(ex.getResponseBodyAsString()), MAX_ERROR_BODY_LENGTH);
            log.warn("Debrid request failed with status {}: {}", ex.getRawStatusCode(), body);
            throw new RemoteException(ex.getRawStatusCode(), body, ex);
        } catch (ResourceAccessException ex) {
            if (Thread.currentThread().isInterrupted() || ex.getCause() instanceof InterruptedIOException) {
                throw new UnlockCancelledException("Debrid request has been interrupted", ex);
            }

            log.warn("Debrid service couldn't be reached, {}", ex.getMessage());
            throw new RemoteException(RemoteException.TRANSPORT_ERROR, StringUtils.defaultString(ex.getMessage()), ex);
        } catch (RestClientException ex) {
            log.error("Failed to read debrid response, {}", ex.getMessage(), ex);
            throw new UnlockException("Failed to read debrid response, " + ex.getMessage(), ex);
        }
    }

    private static HttpEntity<MultiValueMap<String, String>> form(String key, String value) {
        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        var body = new LinkedMultiValueMap<String, String>();
        body.add(key, value);

        return new HttpEntity<>(body, headers);
    }

    //endregion
}
