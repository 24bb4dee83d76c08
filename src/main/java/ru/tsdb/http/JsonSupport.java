package ru.tsdb.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.NotNull;

final class JsonSupport {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private JsonSupport() {
        // Not instantiable
    }

    @NotNull
    static byte[] toBytes(@NotNull Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(value);
    }
}
