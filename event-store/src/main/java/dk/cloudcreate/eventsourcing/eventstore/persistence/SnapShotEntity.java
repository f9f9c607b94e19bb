package dk.cloudcreate.eventsourcing.eventstore.persistence;

import dk.cloudcreate.eventsourcing.aggregates.snapshot.*;
import dk.cloudcreate.eventsourcing.aggregates.types.*;
import dk.cloudcreate.eventsourcing.eventstore.AggregateType;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONSerializer;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Persisted {@link SnapShot}. The event type columns hold the {@link Memento} type and the payload is the memento itself.
 */
public class SnapShotEntity extends EventStoreEntity implements VersionedEntity {
    private final long version;

    public SnapShotEntity(String entityId,
                          String aggregateId,
                          String aggregateTypeName,
                          long version,
                          String mementoTypeFullName,
                          String mementoTypeName,
                          String mementoData,
                          OffsetDateTime createdOn,
                          OffsetDateTime updatedOn,
                          boolean active,
                          boolean deleted) {
        super(entityId, aggregateId, aggregateTypeName, mementoTypeFullName, mementoTypeName, mementoData, createdOn, updatedOn, active, deleted);
        this.version = version;
    }

    public static SnapShotEntity from(SnapShot<?> snapShot, AggregateType aggregateType, JSONSerializer jsonSerializer) {
        requireNonNull(snapShot, "No snapShot provided");
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(jsonSerializer, "No jsonSerializer provided");
        var memento = snapShot.memento();
        return new SnapShotEntity(newEntityId(),
                                  snapShot.aggregateId().toString(),
                                  aggregateType.toString(),
                                  snapShot.version().longValue(),
                                  memento.getClass().getName(),
                                  memento.getClass().getSimpleName(),
                                  jsonSerializer.serialize(memento),
                                  now(),
                                  null,
                                  true,
                                  false);
    }

    /**
     * @param aggregateId the id of the aggregate the snapshot was loaded for
     */
    public <ID extends AggregateId> SnapShot<ID> toSnapShot(ID aggregateId, JSONSerializer jsonSerializer) {
        Memento memento = jsonSerializer.deserialize(eventData(), eventTypeFullName());
        return new SnapShot<>(aggregateId, AggregateVersion.of(version), memento);
    }

    @Override
    public long version() {
        return version;
    }
}
