package com.kvtrack.cache.instrument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Collections;

/**
 * Renders call arguments and results into the text stored in the history lists.
 * Arguments become a compact JSON array of the positional arguments; results are kept as their string form.
 */
public class CallSerializer {

    private final ObjectMapper mapper;

    public CallSerializer(ObjectMapper mapper) {
        // history entries are single-line JSON
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    public String arguments(Object argument) {
        try {
            return mapper.writeValueAsString(Collections.singletonList(argument));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize call arguments: " + e.getOriginalMessage(), e);
        }
    }

    public String result(Object result) {
        return String.valueOf(result);
    }
}
