package org.calista.accuracy.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * JSON text for the {@code toMap()/fromMap()} shapes.
 *
 * <p>Numbers come back as Jackson picks them (Integer/Long for integral values, Double otherwise),
 * which is what the {@code fromMap} factories accept. The text carries no Java type, so an integral
 * {@code Long} that fits in an int is read back as {@code Integer} (and a {@code Float} as {@code Double}).
 * Typed fields are unaffected; values in open metadata maps may compare unequal after a round trip.
 */
public final class AccuracyJson {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public AccuracyJson(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static AccuracyJson withDefaults() {
        return new AccuracyJson(defaultMapper());
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return om;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String write(Map<String, ?> map) throws IOException {
        return mapper.writeValueAsString(map);
    }

    /**
     * @throws IOException when the text is not JSON or its root is not an object
     */
    public Map<String, Object> read(String json) throws IOException {
        Objects.requireNonNull(json, "json");
        Map<String, Object> m = mapper.readValue(json, MAP_TYPE);
        if (m == null) throw new IOException("JSON root is null");
        return m;
    }
}
