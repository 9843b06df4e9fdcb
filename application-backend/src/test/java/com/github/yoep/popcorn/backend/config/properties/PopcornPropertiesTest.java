package com.github.yoep.popcorn.backend.config.properties;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PopcornPropertiesTest {
    @Test
    void testGetProvider_whenNameDiffersInCase_shouldReturnTheProvider() {
        var provider = new ProviderProperties(URI.create("https://v3-cinemeta.strem.io"));
        var properties = new PopcornProperties();
        properties.setProviders(Map.of("Catalog", provider));

        var result = properties.getProvider(PopcornProperties.CATALOG_PROVIDER);

        assertEquals(provider, result);
    }

    @Test
    void testGetProvider_whenProviderIsUnknown_shouldThrowProviderNotFoundException() {
        var properties = new PopcornProperties();

        var ex = assertThrows(ProviderNotFoundException.class, () -> properties.getProvider(PopcornProperties.STREAMS_PROVIDER));

        assertEquals(PopcornProperties.STREAMS_PROVIDER, ex.getName());
    }

    @Test
    void testPlayer_shouldDefaultToMpv() {
        var properties = new PopcornProperties();

        assertEquals("mpv", properties.getPlayer().getCommand());
        assertTrue(properties.getPlayer().getArguments().isEmpty());
    }
}
