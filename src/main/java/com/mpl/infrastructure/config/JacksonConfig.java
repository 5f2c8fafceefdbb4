package com.mpl.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vertx.core.json.jackson.DatabindCodec;

/**
 * Jackson setup shared by the HTTP layer (Vert.x JsonObject mapping) and the case store payloads.
 * Dates travel as ISO strings.
 */
public final class JacksonConfig {

    private static final ObjectMapper MAPPER = configure(new ObjectMapper());

    private JacksonConfig() {
    }

    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Register java.time support on the mapper behind JsonObject.mapFrom / mapTo
     */
    public static void configureVertx() {
        configure(DatabindCodec.mapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
