package dk.cloudcreate.eventsourcing.eventstore.persistence;

import dk.cloudcreate.eventsourcing.aggregates.events.Notification;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;
import dk.cloudcreate.eventsourcing.eventstore.AggregateType;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONSerializer;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Persisted {@link Notification} (outbox entry)
 */
public class NotificationEntity extends EventStoreEntity {
    private final String eventId;

    public NotificationEntity(String entityId,
                              String eventId,
                              String aggregateId,
                              String aggregateTypeName,
                              String eventTypeFullName,
                              String eventTypeName,
                              String eventData,
                              OffsetDateTime createdOn,
                              OffsetDateTime updatedOn,
                              boolean active,
                              boolean deleted) {
        super(entityId, aggregateId, aggregateTypeName, eventTypeFullName, eventTypeName, eventData, createdOn, updatedOn, active, deleted);
        this.eventId = requireNonNull(eventId, "No eventId provided");
    }

    public static NotificationEntity from(Notification<?> notification, AggregateType aggregateType, JSONSerializer jsonSerializer) {
        requireNonNull(notification, "No notification provided");
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(jsonSerializer, "No jsonSerializer provided");
        return new NotificationEntity(newEntityId(),
                                      notification.eventId().toString(),
                                      notification.aggregateId().toString(),
                                      aggregateType.toString(),
                                      notification.getClass().getName(),
                                      notification.getClass().getSimpleName(),
                                      jsonSerializer.serialize(notification),
                                      now(),
                                      null,
                                      true,
                                      false);
    }

    public <ID extends AggregateId> Notification<ID> toNotification(JSONSerializer jsonSerializer) {
        return jsonSerializer.deserialize(eventData(), eventTypeFullName());
    }

    public String eventId() {
        return eventId;
    }
}
