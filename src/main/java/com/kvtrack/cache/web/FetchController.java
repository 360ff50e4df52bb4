package com.kvtrack.cache.web;

import com.kvtrack.cache.fetch.ExpiringFetchCache;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.OptionalLong;

@Validated
@RestController
@RequestMapping("/api/fetch")
public class FetchController {

    @Autowired
    private ExpiringFetchCache fetchCache;

    @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> fetch(@RequestParam @NotBlank String url,
                                        @RequestParam(required = false) @Positive Long expireSeconds) {
        String body = expireSeconds == null
                ? fetchCache.fetch(url)
                : fetchCache.fetch(url, Duration.ofSeconds(expireSeconds));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<FetchStats> stats(@RequestParam @NotBlank String url) {
        OptionalLong ttl = fetchCache.remainingTtlSeconds(url);
        return ResponseEntity.ok(new FetchStats(url, fetchCache.accessCount(url), fetchCache.isCached(url),
                ttl.isPresent() ? ttl.getAsLong() : null));
    }

    public record FetchStats(String url, long accessCount, boolean cached, Long ttlSeconds) {
    }
}
