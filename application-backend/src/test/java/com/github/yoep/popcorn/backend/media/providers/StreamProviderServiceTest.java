package com.github.yoep.popcorn.backend.media.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.yoep.popcorn.backend.config.properties.ProviderProperties;
import com.github.yoep.popcorn.backend.media.providers.models.MediaItem;
import com.github.yoep.popcorn.backend.media.providers.models.MediaType;
import com.github.yoep.popcorn.backend.media.providers.models.StreamsResponse;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamProviderServiceTest {
    private static final String BASE_URL = "https://torrentio.example.com";

    @Mock
    private RestTemplate restTemplate;
    private StreamProviderService service;

    @BeforeEach
    void setUp() {
        service = new StreamProviderService(restTemplate, new ProviderProperties(URI.create(BASE_URL)), Runnable::run);
    }

    @Test
    void testGetStreams_whenMovie_shouldRequestTheMovieStreams() {
        var item = createItem("tt0133093", MediaType.MOVIE);
        when(restTemplate.getForObject(URI.create(BASE_URL + "/stream/movie/tt0133093.json"), StreamsResponse.class)).thenReturn(StreamsResponse.builder()
                .streams(List.of(StreamsResponse.Stream.builder()
                        .name(" Torrentio\n4k ")
                        .title(" The.Matrix.1999.2160p \n")
                        .infoHash(" 0123456789ABCDEF ")
                        .fileIdx(IntNode.valueOf(2))
                        .sources(List.of("tracker:udp://tracker.example.com:1337/announce", "dht:0123456789abcdef"))
                        .build()))
                .build());

        var result = service.getStreams(item, 0, 0).join();

        assertEquals(List.of(StreamDescriptor.builder()
                .displayName("Torrentio\n4k")
                .title("The.Matrix.1999.2160p")
                .rawUrl("")
                .infoHash("0123456789ABCDEF")
                .explicitFileIndex(2)
                .source("tracker:udp://tracker.example.com:1337/announce")
                .source("dht:0123456789abcdef")
                .build()), result);
    }

    @Test
    void testGetStreams_whenSeries_shouldRequestTheEpisodeStreams() {
        var item = createItem("tt0944947", MediaType.SERIES);
        when(restTemplate.getForObject(URI.create(BASE_URL + "/stream/series/tt0944947:2:5.json"), StreamsResponse.class))
                .thenReturn(StreamsResponse.builder()
                        .streams(List.of(StreamsResponse.Stream.builder()
                                .name("Direct")
                                .url("https://cdn.example.com/got.s02e05.mkv")
                                .build()))
                        .build());

        var result = service.getStreams(item, 2, 5).join();

        assertEquals(1, result.size());
        assertEquals("https://cdn.example.com/got.s02e05.mkv", result.get(0).getRawUrl());
        assertEquals(Optional.empty(), result.get(0).getExplicitFileIndex());
    }

    @Test
    void testGetStreams_shouldParseFileIndexLeniently() {
        var item = createItem("tt1", MediaType.MOVIE);
        when(restTemplate.getForObject(isA(URI.class), eq(StreamsResponse.class))).thenReturn(StreamsResponse.builder()
                .streams(List.of(
                        createStream("a", TextNode.valueOf("3")),
                        createStream("b", DoubleNode.valueOf(4.0)),
                        createStream("c", NullNode.getInstance()),
                        createStream("d", TextNode.valueOf("first"))))
                .build());

        var result = service.getStreams(item, 0, 0).join();

        assertEquals(Optional.of(3), result.get(0).getExplicitFileIndex());
        assertEquals(Optional.of(4), result.get(1).getExplicitFileIndex());
        assertEquals(Optional.empty(), result.get(2).getExplicitFileIndex());
        assertEquals(Optional.empty(), result.get(3).getExplicitFileIndex());
    }

    @Test
    void testGetStreams_whenStreamHasNoUrlAndNoHash_shouldDropTheStream() {
        var item = createItem("tt1", MediaType.MOVIE);
        when(restTemplate.getForObject(isA(URI.class), eq(StreamsResponse.class))).thenReturn(StreamsResponse.builder()
                .streams(List.of(
                        StreamsResponse.Stream.builder().name("empty").url("  ").infoHash("").build(),
                        createStream("valid", null)))
                .build());

        var result = service.getStreams(item, 0, 0).join();

        assertEquals(1, result.size());
        assertEquals("valid", result.get(0).getDisplayName());
    }

    @Test
    void testGetStreams_whenResponseIsEmpty_shouldReturnEmptyList() {
        when(restTemplate.getForObject(isA(URI.class), eq(StreamsResponse.class))).thenReturn(null);

        var result = service.getStreams(createItem("tt1", MediaType.MOVIE), 0, 0).join();

        assertTrue(result.isEmpty(), "expected no streams to have been returned");
    }

    @Test
    void testGetStreams_whenMediaTypeIsUnsupported_shouldFail() {
        var item = createItem("tt1", MediaType.UNKNOWN);

        var ex = assertThrows(CompletionException.class, () -> service.getStreams(item, 0, 0).join());

        assertInstanceOf(MediaException.class, ex.getCause());
        verifyNoInteractions(restTemplate);
    }

    @Test
    void testGetStreams_whenIdIsMissing_shouldFail() {
        var item = createItem(" ", MediaType.MOVIE);

        var ex = assertThrows(CompletionException.class, () -> service.getStreams(item, 0, 0).join());

        assertInstanceOf(MediaException.class, ex.getCause());
        verifyNoInteractions(restTemplate);
    }

    private static MediaItem createItem(String id, MediaType type) {
        return MediaItem.builder()
                .id(id)
                .name("Lorem")
                .type(type)
                .build();
    }

    private static StreamsResponse.Stream createStream(String name, JsonNode fileIdx) {
        return StreamsResponse.Stream.builder()
                .name(name)
                .infoHash("abcdef")
                .fileIdx(fileIdx)
                .build();
    }
}
