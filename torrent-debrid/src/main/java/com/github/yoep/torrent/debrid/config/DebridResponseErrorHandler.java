package com.github.yoep.torrent.debrid.config;

import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;

import java.io.IOException;

/**
 * Response error handler which treats every non-2xx response of the debrid api as an error, including redirects.
 */
public class DebridResponseErrorHandler extends DefaultResponseErrorHandler {
    @Override
    public boolean hasError(ClientHttpResponse response) throws IOException {
        return response.getRawStatusCode() / 100 != 2;
    }
}
