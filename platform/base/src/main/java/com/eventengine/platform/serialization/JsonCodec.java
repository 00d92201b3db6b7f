package com.eventengine.platform.serialization;

import com.eventengine.platform.base.Result;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.InputStream;
import java.util.Map;

/**
 * JSON helpers over a shared, preconfigured ObjectMapper.
 *
 * JSON objects decode to {@link java.util.LinkedHashMap}, so key order from the source
 * document is preserved all the way to the response.
 *
 * Usage:
 *   Result<Map<String, Object>> payload = JsonCodec.decodeMap(bytes);
 *   Result<EngineFixture> fixture = JsonCodec.decode(in, EngineFixture.class);
 */
public final class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final ObjectMapper DEFAULT_MAPPER = createDefaultMapper();

    private JsonCodec() {} // Utility class

    /**
     * Get the shared ObjectMapper instance.
     */
    public static ObjectMapper mapper() {
        return DEFAULT_MAPPER;
    }

    public static <A> Result<A> decode(InputStream in, Class<A> clazz) {
        return Result.of(() -> DEFAULT_MAPPER.readValue(in, clazz));
    }

    /**
     * Decode a JSON object into an insertion-ordered map.
     */
    public static Result<Map<String, Object>> decodeMap(byte[] bytes) {
        return Result.of(() -> DEFAULT_MAPPER.readValue(bytes, MAP_TYPE));
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
