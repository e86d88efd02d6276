package com.github.dimitryivaniuta.responsecache.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import static com.fasterxml.jackson.databind.SerializationFeature.WRITE_DATES_AS_TIMESTAMPS;

/**
 * Single ObjectMapper for:
 * - json() response bodies (the live response and the cached copy must serialize identically)
 * - request body canonicalization in fingerprints
 * - the headers field of stored entries
 */
@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return configure(builder.createXmlMapper(false).build());
    }

    /** Applies the cache's serialization rules; also used by tests that run without a context. */
    public static ObjectMapper configure(ObjectMapper mapper) {
        // Time
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(WRITE_DATES_AS_TIMESTAMPS);

        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // "{...} trailing" is not a JSON body and must not be fingerprinted as one
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

        // Floats as trailing-zero-stripped BigDecimal written plain: 1.0 -> 1, 1e2 -> 100
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(false));
        mapper.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);

        // Deterministic output for POJOs and maps; JsonNode trees keep their received order.
        mapper.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

        return mapper;
    }
}
