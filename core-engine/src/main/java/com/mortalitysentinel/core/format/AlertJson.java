package com.mortalitysentinel.core.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for engine output: ISO periods
 * ({@code yyyy-MM}) rather than numeric arrays.
 *
 * @since 1.0.0
 */
public final class AlertJson {

    private AlertJson() {
        // static utility
    }

    /**
     * @return a new, fully configured {@link ObjectMapper}
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
