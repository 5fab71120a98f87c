package alertmigrator.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;

/**
 * Shared Jackson mapper for legacy settings and query models.
 *
 * <p>Query models are decoded and re-encoded by the migration, so floating
 * point numbers are read as exact decimals and keep their scale; a model that
 * is not modified keeps every number value it had.
 *
 * <p>{@link ObjectMapper} is thread-safe once configured.
 */
public final class ObjectMapperProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
            .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);

    private ObjectMapperProvider() {}

    public static ObjectMapper get() {
        return MAPPER;
    }
}
