package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.SnapShot;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;

import java.util.List;

/**
 * Common interface for event sourced aggregates. The aggregate type is bound to exactly one aggregate id type.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 * @see AggregateRoot
 */
public interface Aggregate<ID extends AggregateId, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> extends EventSourced {
    @Override
    ID aggregateId();

    @Override
    List<DomainEvent<ID>> uncommittedEvents();

    /**
     * Rebuild the aggregate state from previously persisted events. The events are sorted by version before
     * they're applied and none of them are added to the {@link #uncommittedEvents()}
     *
     * @param persistedEvents the aggregate's events
     * @return this aggregate instance
     */
    AGGREGATE_TYPE loadFromHistory(Iterable<? extends DomainEvent<ID>> persistedEvents);

    /**
     * Apply a single previously persisted event
     *
     * @param persistedEvent the event
     * @return this aggregate instance
     */
    AGGREGATE_TYPE loadFromHistory(DomainEvent<ID> persistedEvent);

    /**
     * Restore the aggregate state from a snapshot. Only supported by aggregates that implement
     * {@link dk.cloudcreate.eventsourcing.aggregates.snapshot.Originator}
     *
     * @param snapShot the snapshot
     * @return this aggregate instance
     */
    AGGREGATE_TYPE restoreFromSnapShot(SnapShot<ID> snapShot);
}
