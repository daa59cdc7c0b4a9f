package de.htwsaar.offlinecache.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Gemeinsamer JSON-Codec für Admin-Payloads (Kommandos, Partitionslisten, Statistiken).
 */
public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JacksonCodec() {
        // Utility
    }

    /** @return der gemeinsam genutzte, fertig konfigurierte Mapper */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new OfflineCacheSerializationException("Failed to serialize object to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        if (json == null || json.isBlank()) {
            throw new OfflineCacheSerializationException("Cannot deserialize empty JSON to " + clazz.getSimpleName());
        }
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new OfflineCacheSerializationException(
                    "Failed to deserialize JSON to [" + clazz.getSimpleName() + "]", e);
        }
    }
}
