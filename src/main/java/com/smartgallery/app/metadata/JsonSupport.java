package com.smartgallery.app.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Shared Jackson mapper. Thread-safe once configured. */
public final class JsonSupport {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private JsonSupport() {}
}
