package dk.cloudcreate.eventsourcing.eventstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Configuration of an {@link EventStore} for a given {@link AggregateType}
 */
public class EventStoreConfiguration {
    /**
     * The type of aggregate the {@link EventStore} stores events for. Persisted with every entity.
     */
    public final AggregateType  aggregateType;
    /**
     * Serializes and deserializes events, notifications and mementos
     */
    public final JSONSerializer jsonSerializer;

    public EventStoreConfiguration(AggregateType aggregateType, JSONSerializer jsonSerializer) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    /**
     * Configuration that uses a {@link JacksonJSONSerializer} with the {@link JacksonJSONSerializer#createDefaultObjectMapper()}
     */
    public static EventStoreConfiguration standardConfigurationUsingJackson(AggregateType aggregateType) {
        return standardConfigurationUsingJackson(aggregateType, JacksonJSONSerializer.createDefaultObjectMapper());
    }

    public static EventStoreConfiguration standardConfigurationUsingJackson(AggregateType aggregateType, ObjectMapper objectMapper) {
        return new EventStoreConfiguration(aggregateType, new JacksonJSONSerializer(objectMapper));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStoreConfiguration)) return false;
        return aggregateType.equals(((EventStoreConfiguration) o).aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType);
    }

    @Override
    public String toString() {
        return "EventStoreConfiguration{" +
                "aggregateType=" + aggregateType +
                ", jsonSerializer=" + jsonSerializer.getClass().getSimpleName() +
                '}';
    }
}
