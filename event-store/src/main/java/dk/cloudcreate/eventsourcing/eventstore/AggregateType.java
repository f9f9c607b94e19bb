package dk.cloudcreate.eventsourcing.eventstore;

import dk.cloudcreate.essentials.types.*;

/**
 * Name of the category of aggregates an {@link EventStore} stores events for, e.g. <b>Orders</b>.<br>
 * The name is persisted with every row, so it should stay stable even if the aggregate implementation class is renamed.
 */
public class AggregateType extends CharSequenceType<AggregateType> implements Identifier {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
