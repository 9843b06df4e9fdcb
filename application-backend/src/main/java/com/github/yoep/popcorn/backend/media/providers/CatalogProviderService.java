package com.github.yoep.popcorn.backend.media.providers;

import com.github.yoep.popcorn.backend.config.properties.ProviderProperties;
import com.github.yoep.popcorn.backend.media.providers.models.CatalogResponse;
import com.github.yoep.popcorn.backend.media.providers.models.MediaItem;
import com.github.yoep.popcorn.backend.media.providers.models.MediaType;
import com.github.yoep.popcorn.backend.media.providers.models.MetaResponse;
import com.github.yoep.popcorn.backend.media.providers.models.PopularMedia;
import com.github.yoep.popcorn.backend.media.providers.parsers.NumberParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.Assert;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * The catalog provider retrieves the available movies and series from the Cinemeta API.
 */
@Slf4j
public class CatalogProviderService extends AbstractProviderService {
    static final String CATALOG_PATH = "/catalog/{type}/top.json";
    static final String SEARCH_PATH = "/catalog/{type}/top/search={query}.json";
    static final String META_PATH = "/meta/series/{id}.json";
    /**
     * The max. amount of search results returned for a single query.
     */
    public static final int MAX_SEARCH_RESULTS = 60;

    private final Executor executor;

    public CatalogProviderService(RestTemplate restTemplate, ProviderProperties properties, Executor executor) {
        super(restTemplate, properties);
        this.executor = executor;
    }

    /**
     * Retrieve the popular movies and series.
     *
     * @return Returns the popular media of the catalog.
     */
    public CompletableFuture<PopularMedia> getPopular() {
        return CompletableFuture.supplyAsync(this::retrievePopular, executor);
    }

    /**
     * Search the movie and series catalogs for the given query.
     * Both catalogs are queried concurrently, a failure of either of them fails the search once both have completed.
     *
     * @param query The search query.
     * @return Returns the movies followed by the series which match the query.
     */
    public CompletableFuture<List<MediaItem>> search(String query) {
        var keywords = StringUtils.trimToEmpty(query);
        if (keywords.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }

        log.debug("Searching catalog for \"{}\"", keywords);
        var movies = CompletableFuture.supplyAsync(() -> fetchCatalog(MediaType.MOVIE, SEARCH_PATH, keywords), executor);
        var series = CompletableFuture.supplyAsync(() -> fetchCatalog(MediaType.SERIES, SEARCH_PATH, keywords), executor);

        return CompletableFuture.allOf(movies, series)
                .handle((unused, ex) -> merge(movies.join(), series.join()));
    }

    /**
     * Retrieve the available episodes of the given series.
     *
     * @param id The IMDB id of the series.
     * @return Returns the sorted episode numbers per season.
     */
    public CompletableFuture<Map<Integer, List<Integer>>> getEpisodes(String id) {
        Assert.hasText(id, "id cannot be empty");
        return CompletableFuture.supplyAsync(() -> retrieveEpisodes(id), executor);
    }

    PopularMedia retrievePopular() {
        return PopularMedia.builder()
                .movies(fetchCatalog(MediaType.MOVIE, CATALOG_PATH))
                .series(fetchCatalog(MediaType.SERIES, CATALOG_PATH))
                .build();
    }

    Map<Integer, List<Integer>> retrieveEpisodes(String id) {
        var uri = getUriFor(META_PATH, id);
        var seasons = new TreeMap<Integer, TreeSet<Integer>>();

        get(uri, MetaResponse.class)
                .map(MetaResponse::getVideos)
                .orElse(Collections.emptyList())
                .stream()
                .filter(e -> e.getSeason() >= 1 && e.getEpisode() >= 1)
                .forEach(e -> seasons.computeIfAbsent(e.getSeason(), key -> new TreeSet<>()).add(e.getEpisode()));

        var result = new TreeMap<Integer, List<Integer>>();
        seasons.forEach((season, episodes) -> result.put(season, new ArrayList<>(episodes)));
        if (result.isEmpty()) {
            log.debug("Series {} has no episode information, assuming a single episode", id);
            result.put(1, List.of(1));
        }

        return result;
    }

    private List<MediaItem> fetchCatalog(MediaType type, String path, Object... extraVariables) {
        var variables = new ArrayList<>();
        variables.add(type.getKey());
        Collections.addAll(variables, extraVariables);
        var uri = getUriFor(path, variables.toArray());

        var items = get(uri, CatalogResponse.class)
                .map(CatalogResponse::getMetas)
                .orElse(Collections.emptyList())
                .stream()
                .map(e -> toMediaItem(e, type))
                .filter(e -> StringUtils.isNotEmpty(e.getId()) && StringUtils.isNotEmpty(e.getName()))
                .collect(Collectors.toList());
        log.debug("Retrieved {} {} catalog items", items.size(), type.getKey());

        return items;
    }

    private static MediaItem toMediaItem(CatalogResponse.Meta meta, MediaType queriedType) {
        var type = StringUtils.isEmpty(meta.getType()) ? queriedType : MediaType.fromKey(meta.getType());

        return MediaItem.builder()
                .id(meta.getId())
                .name(meta.getName())
                .type(type)
                .year(NumberParser.parseYear(meta.getYear()))
                .poster(meta.getPoster())
                .build();
    }

    private static List<MediaItem> merge(List<MediaItem> movies, List<MediaItem> series) {
        var results = new ArrayList<MediaItem>(movies.size() + series.size());
        results.addAll(movies);
        results.addAll(series);

        return results.size() > MAX_SEARCH_RESULTS ? new ArrayList<>(results.subList(0, MAX_SEARCH_RESULTS)) : results;
    }
}
