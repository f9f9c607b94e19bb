package dk.cloudcreate.eventsourcing.eventstore.persistence;

import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;
import dk.cloudcreate.eventsourcing.eventstore.AggregateType;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONSerializer;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Persisted {@link DomainEvent}
 */
public class DomainEventEntity extends EventStoreEntity implements VersionedEntity {
    private final String eventId;
    private final long   version;

    public DomainEventEntity(String entityId,
                             String eventId,
                             String aggregateId,
                             String aggregateTypeName,
                             long version,
                             String eventTypeFullName,
                             String eventTypeName,
                             String eventData,
                             OffsetDateTime createdOn,
                             OffsetDateTime updatedOn,
                             boolean active,
                             boolean deleted) {
        super(entityId, aggregateId, aggregateTypeName, eventTypeFullName, eventTypeName, eventData, createdOn, updatedOn, active, deleted);
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.version = version;
    }

    public static DomainEventEntity from(DomainEvent<?> event, AggregateType aggregateType, JSONSerializer jsonSerializer) {
        requireNonNull(event, "No event provided");
        requireNonNull(event.aggregateId(), "The event doesn't have an aggregateId");
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(jsonSerializer, "No jsonSerializer provided");
        return new DomainEventEntity(newEntityId(),
                                     event.eventId().toString(),
                                     event.aggregateId().toString(),
                                     aggregateType.toString(),
                                     event.version().longValue(),
                                     event.getClass().getName(),
                                     event.getClass().getSimpleName(),
                                     jsonSerializer.serialize(event),
                                     now(),
                                     null,
                                     true,
                                     false);
    }

    /**
     * @throws dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONDeserializationException if the event type can't be resolved
     */
    public <ID extends AggregateId> DomainEvent<ID> toEvent(JSONSerializer jsonSerializer) {
        return jsonSerializer.deserialize(eventData(), eventTypeFullName());
    }

    public String eventId() {
        return eventId;
    }

    @Override
    public long version() {
        return version;
    }
}
