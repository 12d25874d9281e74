package taskmesh.node.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mapper for advertisements and HTTP responses.
 */
public final class JsonMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
            .findAndRegisterModules();

    private JsonMapper() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
