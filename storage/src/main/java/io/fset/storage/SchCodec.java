package io.fset.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/** JSON text encoding of the opaque fmodel payload. */
final class SchCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper json = new ObjectMapper();

    String encode(Map<String, Object> sch) {
        try {
            return json.writeValueAsString(sch);
        } catch (JsonProcessingException e) {
            throw new StorageException("sch is not serializable as JSON", e);
        }
    }

    Map<String, Object> decode(String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        try {
            return json.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("stored sch is not a JSON object", e);
        }
    }
}
