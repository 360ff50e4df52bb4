package com.kvtrack.cache.web;

import com.kvtrack.cache.common.Result;
import com.kvtrack.cache.common.exception.Http;
import com.kvtrack.cache.common.exception.ValidationException;
import com.kvtrack.cache.instrument.CallReplayer;
import com.kvtrack.cache.instrument.CallTrace;
import com.kvtrack.cache.instrument.OperationId;
import com.kvtrack.cache.store.Coercions;
import com.kvtrack.cache.store.ObjectStore;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/cache")
public class CacheController {

    @Autowired
    private ObjectStore objectStore;

    @Autowired
    private CallReplayer replayer;

    @PostMapping
    public ResponseEntity<?> store(@Valid @RequestBody StoreRequest req) {
        String key = objectStore.store(req.toStoredValue());
        return Http.from(Result.ok(Map.of("key", key)));
    }

    // as = bytes (base64 in JSON) | text | integer | float
    @GetMapping("/{key}")
    public ResponseEntity<?> retrieve(@PathVariable String key,
                                      @RequestParam(defaultValue = "text") String as) {
        Optional<?> value = switch (as.toLowerCase(Locale.ROOT)) {
            case "bytes" -> objectStore.retrieve(key, Coercions.BYTES);
            case "text" -> objectStore.retrieveAsText(key);
            case "integer" -> objectStore.retrieveAsInteger(key);
            case "float" -> objectStore.retrieveAsFloat(key);
            default -> throw new ValidationException("Unknown coercion '" + as + "'");
        };
        Result<Object> r = value.<Result<Object>>map(v -> Result.ok(Map.of("key", key, "value", v)))
                .orElseGet(() -> Result.fail(Http.NOT_FOUND, "No value stored under " + key));
        return Http.from(r);
    }

    @GetMapping("/replay/{operation}")
    public ResponseEntity<CallTrace> replay(@PathVariable String operation) {
        return ResponseEntity.ok(replayer.trace(OperationId.of(operation)));
    }
}
