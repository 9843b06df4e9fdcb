package com.github.yoep.popcorn.backend.media.providers;

import com.github.yoep.popcorn.backend.config.properties.ProviderProperties;
import com.github.yoep.popcorn.backend.media.providers.models.MediaItem;
import com.github.yoep.popcorn.backend.media.providers.models.StreamsResponse;
import com.github.yoep.popcorn.backend.media.providers.parsers.NumberParser;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.Assert;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * The stream provider retrieves the available playback candidates of a media item from the Torrentio API.
 */
@Slf4j
public class StreamProviderService extends AbstractProviderService {
    static final String MOVIE_PATH = "/stream/movie/{id}.json";
    static final String SERIES_PATH = "/stream/series/{id}:{season}:{episode}.json";

    private final Executor executor;

    public StreamProviderService(RestTemplate restTemplate, ProviderProperties properties, Executor executor) {
        super(restTemplate, properties);
        this.executor = executor;
    }

    /**
     * Retrieve the streams of the given media item.
     * The season and episode are only used for series.
     *
     * @param item    The media item to retrieve the streams of.
     * @param season  The season of the series.
     * @param episode The episode of the series.
     * @return Returns the resolvable streams of the media item.
     */
    public CompletableFuture<List<StreamDescriptor>> getStreams(MediaItem item, int season, int episode) {
        Assert.notNull(item, "item cannot be null");
        return CompletableFuture.supplyAsync(() -> retrieveStreams(item, season, episode), executor);
    }

    List<StreamDescriptor> retrieveStreams(MediaItem item, int season, int episode) {
        if (StringUtils.isBlank(item.getId())) {
            throw new MediaException("Media item is missing an id");
        }

        var uri = getStreamUri(item, season, episode);
        var streams = get(uri, StreamsResponse.class)
                .map(StreamsResponse::getStreams)
                .orElse(Collections.emptyList())
                .stream()
                .filter(Objects::nonNull)
                .map(StreamProviderService::toDescriptor)
                .filter(StreamDescriptor::isResolvable)
                .collect(Collectors.toList());
        log.debug("Retrieved {} streams for {}", streams.size(), item.getId());

        return streams;
    }

    private URI getStreamUri(MediaItem item, int season, int episode) {
        switch (item.getType()) {
            case MOVIE:
                return getUriFor(MOVIE_PATH, item.getId());
            case SERIES:
                return getUriFor(SERIES_PATH, item.getId(), season, episode);
            default:
                throw new MediaException(MessageFormat.format("Media type {0} is not supported", item.getType()));
        }
    }

    private static StreamDescriptor toDescriptor(StreamsResponse.Stream stream) {
        return StreamDescriptor.builder()
                .displayName(StringUtils.trimToEmpty(stream.getName()))
                .title(StringUtils.trimToEmpty(stream.getTitle()))
                .rawUrl(StringUtils.trimToEmpty(stream.getUrl()))
                .infoHash(StringUtils.trimToEmpty(stream.getInfoHash()))
                .explicitFileIndex(NumberParser.parseOptionalInt(stream.getFileIdx()).orElse(null))
                .sources(Optional.ofNullable(stream.getSources())
                        .map(sources -> sources.stream().filter(Objects::nonNull).collect(Collectors.toList()))
                        .orElse(Collections.emptyList()))
                .build();
    }
}
