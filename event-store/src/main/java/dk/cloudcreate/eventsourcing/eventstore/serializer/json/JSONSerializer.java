package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON serializer and deserializer for event, notification and memento payloads
 */
public interface JSONSerializer {
    /**
     * Deserialize the <code>json</code> into the Java type named by the Fully Qualified Class Name in <code>javaType</code>
     *
     * @param json     the json payload
     * @param javaType the Fully Qualified Class Name of the Java type
     * @param <T>      the corresponding Java type
     * @return the deserialized payload
     * @throws JSONDeserializationException if the Java type couldn't be resolved or the json couldn't be deserialized
     */
    <T> T deserialize(String json, String javaType);

    /**
     * @throws JSONDeserializationException if the json couldn't be deserialized into the Java type
     */
    <T> T deserialize(String json, Class<T> javaType);

    /**
     * @throws JSONSerializationException if the object couldn't be serialized
     */
    String serialize(Object objectToSerialize);

    /**
     * Parse the json into a tree, e.g. to evaluate a payload predicate
     *
     * @throws JSONDeserializationException if the json is malformed
     */
    JsonNode readTree(String json);
}
