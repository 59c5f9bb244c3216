package com.resonance.matrix.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the Jackson mappers used across the library.
 *
 * <p>Instants are written as ISO-8601 strings and unknown properties are ignored
 * so that older and newer documents stay readable.</p>
 */
public final class MatrixJson {

    private MatrixJson() {
    }

    /**
     * Mapper producing indented output, used for documents and checkpoints.
     */
    public static ObjectMapper prettyMapper() {
        return baseBuilder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /**
     * Mapper producing single-line output, used for line-delimited logs.
     */
    public static ObjectMapper compactMapper() {
        return baseBuilder()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    private static JsonMapper.Builder baseBuilder() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }
}
