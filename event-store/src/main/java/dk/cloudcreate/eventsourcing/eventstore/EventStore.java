package dk.cloudcreate.eventsourcing.eventstore;

import dk.cloudcreate.eventsourcing.aggregates.Aggregate;
import dk.cloudcreate.eventsourcing.aggregates.events.*;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.*;
import dk.cloudcreate.eventsourcing.aggregates.types.*;
import dk.cloudcreate.eventsourcing.eventstore.persistence.*;
import reactor.core.publisher.*;

/**
 * Persistence boundary for the events, notifications and snapshots of one {@link AggregateType}.<br>
 * Every operation is lazy: nothing happens until the returned publisher is subscribed to, and disposing the
 * subscription cancels the remaining work.
 *
 * @param <ID> the aggregate id type
 * @see DefaultEventStore
 */
public interface EventStore<ID extends AggregateId> {
    AggregateType aggregateType();

    /**
     * Append a single domain event
     *
     * @return a {@link Mono} that fails with {@link OptimisticAppendToEventStoreException} if an event with the same
     * aggregate id and version has already been appended, or with {@link AppendToEventStoreException} for other storage failures
     */
    Mono<Void> appendEvent(DomainEvent<ID> event);

    /**
     * Append a notification to the outbox
     */
    Mono<Void> appendNotification(Notification<ID> notification);

    /**
     * @return every event of the aggregate in ascending version order; empty if the aggregate has no events
     */
    Flux<DomainEvent<ID>> readAllEvents(ID aggregateId);

    /**
     * @return the events with a version greater than <code>version</code>, in ascending version order
     */
    Flux<DomainEvent<ID>> readEventsAfter(ID aggregateId, AggregateVersion version);

    /**
     * Query the stored entities of this store's aggregate type
     *
     * @param entityType {@link DomainEventEntity}, {@link NotificationEntity} or {@link SnapShotEntity}
     * @param criteria   the criteria the entities must match (the aggregate id is part of the criteria)
     */
    <ENTITY extends EventStoreEntity> Flux<ENTITY> readStoreEntities(Class<ENTITY> entityType, EventStoreEntityCriteria criteria);

    <ENTITY extends EventStoreEntity> Mono<Long> countStoreEntities(Class<ENTITY> entityType, EventStoreEntityCriteria criteria);

    /**
     * @return the outbox notifications matching the criteria, in insertion order
     */
    Flux<Notification<ID>> readNotifications(EventStoreEntityCriteria criteria);

    /**
     * @return the snapshot with the highest version (the newest one if several share that version); empty if none exists
     */
    Mono<SnapShot<ID>> getSnapShot(ID aggregateId);

    /**
     * Store a snapshot of the aggregate, replacing an existing snapshot for the same aggregate id and version
     *
     * @param aggregate an aggregate that implements {@link Originator}
     * @return a {@link Mono} that fails with {@link dk.cloudcreate.eventsourcing.aggregates.AggregateException} if the
     * aggregate doesn't implement {@link Originator}
     */
    Mono<Void> appendSnapShot(Aggregate<ID, ?> aggregate);

    /**
     * @return the events after the latest snapshot, or all events if there's no snapshot
     */
    Flux<DomainEvent<ID>> readEventsSinceLastSnapShot(ID aggregateId);

    /**
     * @return the number of events after the latest snapshot, or the number of all events if there's no snapshot
     */
    Mono<Long> readEventCountSinceLastSnapShot(ID aggregateId);
}
