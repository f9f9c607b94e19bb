package dk.cloudcreate.eventsourcing.eventstore.accessor;

import dk.cloudcreate.eventsourcing.aggregates.Aggregate;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;
import dk.cloudcreate.eventsourcing.eventstore.AggregateNotFoundException;
import reactor.core.publisher.Mono;

/**
 * Stores and rehydrates aggregates of one type through an {@link dk.cloudcreate.eventsourcing.eventstore.EventStore}
 *
 * @param <ID>        the aggregate id type
 * @param <AGGREGATE> the aggregate implementation type
 * @see DefaultAggregateAccessor
 */
public interface AggregateAccessor<ID extends AggregateId, AGGREGATE extends Aggregate<ID, AGGREGATE>> {
    /**
     * Append the aggregate's uncommitted events in version order, publishing each event after it has been appended.
     * The uncommitted events are only marked as committed once all of them have been appended and published.<br>
     * Pending notifications of aggregates that implement {@link dk.cloudcreate.eventsourcing.aggregates.notifications.NotificationSourcing}
     * are afterwards appended to the outbox, published and marked as committed.
     */
    Mono<Void> append(AGGREGATE aggregate);

    /**
     * Rehydrate the aggregate from all of its events
     *
     * @return the aggregate, or an empty {@link Mono} if no events exist for the aggregate id
     */
    Mono<AGGREGATE> read(ID aggregateId);

    /**
     * Same as {@link #read(AggregateId)} but fails with {@link AggregateNotFoundException} if the aggregate doesn't exist
     */
    Mono<AGGREGATE> load(ID aggregateId);

    /**
     * Rehydrate the aggregate from its latest snapshot plus the events appended after it. Falls back to {@link #read(AggregateId)}
     * if no snapshot exists.
     */
    Mono<AGGREGATE> readFromSnapShot(ID aggregateId);

    /**
     * Store a snapshot of the aggregate's current state
     */
    Mono<Void> appendAsSnapShot(AGGREGATE aggregate);

    /**
     * @return the number of events appended since the latest snapshot
     */
    Mono<Long> eventCountSinceLastSnapShot(ID aggregateId);
}
