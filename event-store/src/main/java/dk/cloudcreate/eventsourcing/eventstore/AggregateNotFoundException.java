package dk.cloudcreate.eventsourcing.eventstore;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate that is required to exist has no events
 */
public class AggregateNotFoundException extends EventStoreException {
    public final Object        aggregateId;
    public final Class<?>      aggregateImplementationType;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateImplementationType, AggregateType aggregateType) {
        super(msg("[{}] Couldn't find a '{}' aggregate with id '{}'",
                  aggregateType,
                  requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType").getName(),
                  aggregateId));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateImplementationType = aggregateImplementationType;
        this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
    }
}
