package com.signalhub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * One mapper for both sides of the hub: the WebSocket envelope codec and the
 * room diagnostics endpoints.
 */
@Configuration
public class JacksonConfig {

    /**
     * Envelopes from browsers often carry fields the hub does not know
     * (client timestamps, SDK metadata); those are ignored rather than failing
     * the whole frame. Room snapshots and error frames write their instants as
     * ISO-8601 strings.
     */
    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper mapper = builder
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        return mapper.registerModule(new JavaTimeModule());
    }
}
