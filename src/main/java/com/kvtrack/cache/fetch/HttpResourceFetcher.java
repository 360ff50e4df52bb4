package com.kvtrack.cache.fetch;

import com.kvtrack.cache.common.exception.UpstreamFetchException;
import com.kvtrack.cache.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches a page body with a plain GET. Non-2xx answers count as failures.
 */
@Slf4j
public class HttpResourceFetcher implements ResourceFetcher {

    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpResourceFetcher(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), requestTimeout);
    }

    HttpResourceFetcher(HttpClient http, Duration requestTimeout) {
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String fetch(String resource) {
        final HttpRequest req;
        try {
            req = HttpRequest.newBuilder(URI.create(resource))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Not a valid http(s) URL: " + resource, e);
        }
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new UpstreamFetchException("GET " + resource + " returned HTTP " + resp.statusCode());
            }
            log.debug("Fetched {} ({} chars)", resource, resp.body().length());
            return resp.body();
        } catch (IOException e) {
            throw new UpstreamFetchException("GET " + resource + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("GET " + resource + " interrupted", e);
        }
    }
}
