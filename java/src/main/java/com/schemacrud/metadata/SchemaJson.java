package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for schema documents: unknown keys are
 * tolerated on read and absent values are left out on write, so a bound
 * document serialises back to its canonical JSON.
 */
public final class SchemaJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private SchemaJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
