package com.github.yoep.torrent.adapter;

import com.github.yoep.torrent.adapter.model.PlayableReference;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DescriptorNormalizerTest {
    @Test
    void testNormalize_whenUrlIsHttp_shouldReturnDirectUrl() {
        var url = "https://cdn.example.com/movie.mp4";
        var descriptor = StreamDescriptor.builder()
                .rawUrl(url)
                .infoHash("ABCDEF")
                .build();

        var result = DescriptorNormalizer.normalize(descriptor);

        assertEquals(PlayableReference.directUrl(url), result);
    }

    @Test
    void testNormalize_whenUrlPrefixHasDifferentCase_shouldStillReturnDirectUrl() {
        var url = "HTTP://cdn.example.com/movie.mp4";
        var descriptor = StreamDescriptor.builder()
                .rawUrl(url)
                .build();

        var result = DescriptorNormalizer.normalize(descriptor);

        assertEquals(PlayableReference.Kind.DIRECT_URL, result.kind());
        assertEquals(url, result.url());
    }

    @Test
    void testNormalize_whenUrlIsMagnet_shouldUseMagnetVerbatim() {
        var magnet = "Magnet:?xt=urn:btih:ABCDEF&dn=Lorem";
        var descriptor = StreamDescriptor.builder()
                .rawUrl(magnet)
                .infoHash("123456")
                .source("tracker:udp://tracker.example.org:1337")
                .build();

        var result = DescriptorNormalizer.normalize(descriptor);

        assertEquals(PlayableReference.magnetUri(magnet), result);
    }

    @Test
    void testNormalize_whenOnlyInfoHashIsPresent_shouldSynthesizeMagnet() {
        var descriptor = StreamDescriptor.builder()
                .infoHash("ABCDEF")
                .sources(List.of("tracker:B", "tracker:A", "tracker:B"))
                .build();

        var result = DescriptorNormalizer.normalize(descriptor);

        assertEquals(PlayableReference.Kind.HASH_SYNTHESIZED, result.kind());
        assertEquals("magnet:?xt=urn:btih:abcdef&tr=B&tr=A", result.url());
    }

    @Test
    void testNormalize_whenUrlIsNeitherHttpNorMagnet_shouldSynthesizeMagnet() {
        var descriptor = StreamDescriptor.builder()
                .rawUrl("ftp://example.org/file")
                .infoHash("abc")
                .build();

        var result = DescriptorNormalizer.normalize(descriptor);

        assertEquals(PlayableReference.hashSynthesized("magnet:?xt=urn:btih:abc"), result);
    }

    @Test
    void testNormalize_whenInfoHashIsEmpty_shouldReturnUnavailableReference() {
        var descriptor = StreamDescriptor.builder()
                .displayName("lorem")
                .source("tracker:udp://tracker.example.org:1337")
                .build();

        var result = DescriptorNormalizer.normalize(descriptor);

        assertEquals(PlayableReference.Kind.HASH_SYNTHESIZED, result.kind());
        assertFalse(result.isAvailable(), "Expected no magnet to be available");
    }

    @Test
    void testNormalize_whenInvokedTwice_shouldReturnIdenticalMagnet() {
        var descriptor = StreamDescriptor.builder()
                .infoHash("C0FFEE")
                .source("tracker:udp://open.tracker.org:6969/announce")
                .source("dht:C0FFEE")
                .source("tracker:http://Tracker.Example.com/announce")
                .build();

        var first = DescriptorNormalizer.normalize(descriptor);
        var second = DescriptorNormalizer.normalize(descriptor);

        assertEquals(first.url(), second.url());
        assertEquals(first, second);
    }

    @Test
    void testBuildMagnet_whenTrackerContainsReservedCharacters_shouldUrlEncodeTracker() {
        var result = DescriptorNormalizer.buildMagnet("ABC", List.of("tracker:udp://Tracker.org:80/announce?key=1"));

        assertEquals("magnet:?xt=urn:btih:abc&tr=udp%3A%2F%2FTracker.org%3A80%2Fannounce%3Fkey%3D1", result);
    }

    @Test
    void testBuildMagnet_whenTrackerContainsTildeOrAsterisk_shouldQueryEscapeTracker() {
        var result = DescriptorNormalizer.buildMagnet("ABC", List.of("tracker:udp://host/~user*", "tracker:http://host/a b"));

        assertEquals("magnet:?xt=urn:btih:abc&tr=udp%3A%2F%2Fhost%2F~user%2A&tr=http%3A%2F%2Fhost%2Fa+b", result);
    }

    @Test
    void testBuildMagnet_whenSourcesAreNotTrackers_shouldIgnoreThem() {
        var result = DescriptorNormalizer.buildMagnet("ABC", List.of("dht:ABC", "Tracker:upper", "tracker:   ", "tracker: padded "));

        assertEquals("magnet:?xt=urn:btih:abc&tr=padded", result);
    }

    @Test
    void testBuildMagnet_whenSourcesAreNull_shouldOnlyContainHash() {
        var result = DescriptorNormalizer.buildMagnet("ABC", null);

        assertEquals("magnet:?xt=urn:btih:abc", result);
    }

    @Test
    void testBuildMagnet_whenInfoHashIsEmpty_shouldReturnEmptyString() {
        var result = DescriptorNormalizer.buildMagnet("", Collections.singletonList("tracker:A"));

        assertEquals("", result);
    }
}
