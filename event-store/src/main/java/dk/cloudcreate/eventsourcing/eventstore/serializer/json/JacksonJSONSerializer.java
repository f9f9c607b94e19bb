package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.types.jackson.EssentialTypesJacksonModule;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}.<br>
 * Resolved payload types are cached by their Fully Qualified Class Name.
 *
 * @see #createDefaultObjectMapper()
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private final ObjectMapper                       objectMapper;
    private final ClassLoader                        classLoader;
    private final ConcurrentMap<String, Class<?>> resolvedTypes = new ConcurrentHashMap<>();

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this(objectMapper, Thread.currentThread().getContextClassLoader());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper, ClassLoader classLoader) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper instance provided");
        this.classLoader = classLoader != null ? classLoader : JacksonJSONSerializer.class.getClassLoader();
    }

    /**
     * Create an {@link ObjectMapper} that serializes the private fields of events and mementos (getters are ignored),
     * supports the essentials semantic types and writes <code>java.time</code> values as ISO-8601 strings
     */
    public static ObjectMapper createDefaultObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        objectMapper.setVisibility(objectMapper.getSerializationConfig().getDefaultVisibilityChecker()
                                               .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withIsGetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withSetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                                               .withCreatorVisibility(JsonAutoDetect.Visibility.ANY));
        objectMapper.registerModule(new EssentialTypesJacksonModule());
        objectMapper.registerModule(new JavaTimeModule());
        return objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T deserialize(String json, String javaType) {
        requireNonNull(javaType, "No javaType provided");
        return (T) deserialize(json, resolveType(javaType));
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    @Override
    public String serialize(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @Override
    public JsonNode readTree(String json) {
        requireNonNull(json, "No json provided");
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException("Failed to parse JSON", e);
        }
    }

    private Class<?> resolveType(String javaType) {
        var type = resolvedTypes.get(javaType);
        if (type == null) {
            try {
                type = Class.forName(javaType, false, classLoader);
            } catch (ClassNotFoundException e) {
                throw new JSONDeserializationException(msg("Failed to resolve Java type '{}'", javaType), e);
            }
            resolvedTypes.put(javaType, type);
        }
        return type;
    }
}
