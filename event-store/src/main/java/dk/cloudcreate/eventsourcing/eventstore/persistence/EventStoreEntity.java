package dk.cloudcreate.eventsourcing.eventstore.persistence;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The row shape shared by every entity the event store persists. The payload is stored as JSON together with the
 * Fully Qualified Class Name of its Java type, which is used to deserialize it again.
 *
 * @see DomainEventEntity
 * @see NotificationEntity
 * @see SnapShotEntity
 */
public abstract class EventStoreEntity {
    private final String         entityId;
    private final String         aggregateId;
    private final String         aggregateTypeName;
    private final String         eventTypeFullName;
    private final String         eventTypeName;
    private final String         eventData;
    private final OffsetDateTime createdOn;
    private final OffsetDateTime updatedOn;
    private final boolean        active;
    private final boolean        deleted;

    protected EventStoreEntity(String entityId,
                               String aggregateId,
                               String aggregateTypeName,
                               String eventTypeFullName,
                               String eventTypeName,
                               String eventData,
                               OffsetDateTime createdOn,
                               OffsetDateTime updatedOn,
                               boolean active,
                               boolean deleted) {
        this.entityId = requireNonNull(entityId, "No entityId provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateTypeName = requireNonNull(aggregateTypeName, "No aggregateTypeName provided");
        this.eventTypeFullName = requireNonNull(eventTypeFullName, "No eventTypeFullName provided");
        this.eventTypeName = requireNonNull(eventTypeName, "No eventTypeName provided");
        this.eventData = requireNonNull(eventData, "No eventData provided");
        this.createdOn = requireNonNull(createdOn, "No createdOn provided");
        this.updatedOn = updatedOn;
        this.active = active;
        this.deleted = deleted;
    }

    /**
     * @return a new opaque primary key
     */
    public static String newEntityId() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
    }

    /**
     * @return the current time with the precision the relational storage keeps
     */
    protected static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    public String entityId() {
        return entityId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateTypeName() {
        return aggregateTypeName;
    }

    public String eventTypeFullName() {
        return eventTypeFullName;
    }

    public String eventTypeName() {
        return eventTypeName;
    }

    public String eventData() {
        return eventData;
    }

    public OffsetDateTime createdOn() {
        return createdOn;
    }

    public Optional<OffsetDateTime> updatedOn() {
        return Optional.ofNullable(updatedOn);
    }

    public boolean isActive() {
        return active;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entityId.equals(((EventStoreEntity) o).entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "entityId='" + entityId + '\'' +
                ", aggregateId='" + aggregateId + '\'' +
                ", aggregateTypeName='" + aggregateTypeName + '\'' +
                ", eventTypeName='" + eventTypeName + '\'' +
                ", createdOn=" + createdOn +
                '}';
    }
}
