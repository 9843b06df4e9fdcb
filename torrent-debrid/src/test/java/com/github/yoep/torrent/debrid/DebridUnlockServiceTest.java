package com.github.yoep.torrent.debrid;

import com.github.yoep.torrent.adapter.*;
import com.github.yoep.torrent.adapter.state.UnlockState;
import com.github.yoep.torrent.debrid.config.DebridProperties;
import com.github.yoep.torrent.debrid.model.AddMagnetResponse;
import com.github.yoep.torrent.debrid.model.UnrestrictResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DebridUnlockServiceTest {
    private static final String MAGNET = "magnet:?xt=urn:btih:abcdef";

    @Mock
    private RestTemplate restTemplate;

    private DebridProperties properties;
    private DebridUnlockService service;

    @BeforeEach
    void setUp() {
        properties = new DebridProperties();
        properties.setToken("my-token");
        service = new DebridUnlockService(restTemplate, properties, duration -> {
        });
    }

    @Test
    void testIsEnabled_whenTokenIsBlank_shouldReturnFalse() {
        properties.setToken("   ");

        assertFalse(service.isEnabled());
    }

    @Test
    void testIsEnabled_whenTokenIsConfigured_shouldReturnTrue() {
        assertTrue(service.isEnabled());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRegister_whenServiceReturnsId_shouldReturnRegisteredSession() {
        var request = new AtomicReference<HttpEntity<MultiValueMap<String, String>>>();
        when(restTemplate.postForObject(eq(DebridUnlockService.ADD_MAGNET_PATH), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenAnswer(invocation -> {
                    request.set(invocation.getArgument(1, HttpEntity.class));
                    return AddMagnetResponse.builder()
                            .id("TORRENT1")
                            .build();
                });

        var result = service.register(MAGNET);

        assertEquals("TORRENT1", result.getHandle().id());
        assertEquals(UnlockState.REGISTERED, result.getState());
        assertEquals(MAGNET, request.get().getBody().getFirst("magnet"));
        assertEquals(MediaType.APPLICATION_FORM_URLENCODED, request.get().getHeaders().getContentType());
    }

    @Test
    void testRegister_whenServiceReturnsNoId_shouldThrowEmptyHandleException() {
        when(restTemplate.postForObject(eq(DebridUnlockService.ADD_MAGNET_PATH), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenReturn(AddMagnetResponse.builder()
                        .id("")
                        .build());

        assertThrows(EmptyHandleException.class, () -> service.register(MAGNET));
    }

    @Test
    void testRegister_whenServiceReturnsNoBody_shouldThrowEmptyHandleException() {
        when(restTemplate.postForObject(eq(DebridUnlockService.ADD_MAGNET_PATH), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenReturn(null);

        assertThrows(EmptyHandleException.class, () -> service.register(MAGNET));
    }

    @Test
    void testRegister_whenServiceRespondsWithErrorStatus_shouldThrowRemoteExceptionWithStatusAndBody() {
        var body = "{\"error\": \"bad_token\", \"error_code\": 8}";
        when(restTemplate.postForObject(eq(DebridUnlockService.ADD_MAGNET_PATH), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenThrow(HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized", HttpHeaders.EMPTY,
                        body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));

        var result = assertThrows(RemoteException.class, () -> service.register(MAGNET));

        assertEquals(401, result.getStatus());
        assertEquals(body, result.getBody());
    }

    @Test
    void testRegister_whenErrorBodyIsLarge_shouldTruncateBody() {
        var body = "x".repeat(5000);
        when(restTemplate.postForObject(eq(DebridUnlockService.ADD_MAGNET_PATH), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenThrow(HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Unavailable", HttpHeaders.EMPTY,
                        body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));

        var result = assertThrows(RemoteException.class, () -> service.register(MAGNET));

        assertEquals(503, result.getStatus());
        assertEquals(DebridUnlockService.MAX_ERROR_BODY_LENGTH, result.getBody().length());
    }

    @Test
    void testRegister_whenServiceIsUnreachable_shouldThrowRemoteExceptionWithTransportStatus() {
        when(restTemplate.postForObject(eq(DebridUnlockService.ADD_MAGNET_PATH), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenThrow(new ResourceAccessException("Connection refused", new IOException("Connection refused")));

        var result = assertThrows(RemoteException.class, () -> service.register(MAGNET));

        assertEquals(RemoteException.TRANSPORT_ERROR, result.getStatus());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUnrestrict_whenServiceReturnsDownload_shouldReturnDownloadUrl() {
        var link = "https://real-debrid.com/d/LOREM";
        var download = "https://download.real-debrid.com/d/LOREM/movie.mkv";
        var request = new AtomicReference<HttpEntity<MultiValueMap<String, String>>>();
        when(restTemplate.postForObject(eq(DebridUnlockService.UNRESTRICT_PATH), isA(HttpEntity.class), eq(UnrestrictResponse.class)))
                .thenAnswer(invocation -> {
                    request.set(invocation.getArgument(1, HttpEntity.class));
                    return UnrestrictResponse.builder()
                            .download(download)
                            .build();
                });

        var result = service.unrestrict(link);

        assertEquals(download, result);
        assertEquals(link, request.get().getBody().getFirst("link"));
    }

    @Test
    void testUnrestrict_whenResponseHasNoDownload_shouldThrowEmptyDownloadUrlException() {
        when(restTemplate.postForObject(eq(DebridUnlockService.UNRESTRICT_PATH), isA(HttpEntity.class), eq(UnrestrictResponse.class)))
                .thenReturn(UnrestrictResponse.builder()
                        .link("https://real-debrid.com/d/LOREM")
                        .build());

        assertThrows(EmptyDownloadUrlException.class, () -> service.unrestrict("https://real-debrid.com/d/LOREM"));
    }

    @Test
    void testUnrestrict_whenServiceRespondsWithErrorStatus_shouldThrowRemoteException() {
        when(restTemplate.postForObject(eq(DebridUnlockService.UNRESTRICT_PATH), isA(HttpEntity.class), eq(UnrestrictResponse.class)))
                .thenThrow(HttpClientErrorException.create(HttpStatus.FORBIDDEN, "Forbidden", HttpHeaders.EMPTY,
                        new byte[0], StandardCharsets.UTF_8));

        var result = assertThrows(RemoteException.class, () -> service.unrestrict("https://example.com/file.mkv"));

        assertEquals(403, result.getStatus());
        assertEquals("", result.getBody());
    }

    @Test
    void testRegister_whenMagnetIsEmpty_shouldThrowIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> service.register(""));

        verifyNoInteractions(restTemplate);
    }
}
