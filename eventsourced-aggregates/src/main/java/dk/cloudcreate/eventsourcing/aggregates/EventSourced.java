package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import dk.cloudcreate.eventsourcing.aggregates.types.*;

import java.util.List;

/**
 * Id-less view of an event sourced aggregate, for code that handles aggregates of any type
 * (e.g. generic logging or storage iteration)
 *
 * @see Aggregate
 */
public interface EventSourced {
    /**
     * @return the aggregate id or null if the aggregate hasn't applied any events
     */
    AggregateId aggregateId();

    /**
     * @return the version of the last applied event or {@link AggregateVersion#NO_EVENTS_APPLIED}
     */
    AggregateVersion version();

    /**
     * @return true if the aggregate has no (or an empty) aggregate id
     */
    boolean isEmpty();

    /**
     * @return true if the aggregate state was rebuilt from history or a snapshot
     */
    boolean hasBeenRehydrated();

    /**
     * @return the events raised since the last {@link #markEventsAsCommitted()}, ordered by version
     */
    List<? extends DomainEvent<?>> uncommittedEvents();

    /**
     * Clear the uncommitted events after they have been appended to the event store
     */
    void markEventsAsCommitted();
}
