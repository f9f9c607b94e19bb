package dk.cloudcreate.eventsourcing.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate is asked to apply an event type it hasn't registered a handler for
 */
public class EventHandlerNotRegisteredException extends AggregateException {
    public final Class<?> eventType;
    public final Class<?> aggregateType;

    public EventHandlerNotRegisteredException(Class<?> eventType, Class<?> aggregateType) {
        super(msg("The '{}' requested event handler is not registered in aggregate '{}'",
                  eventType.getName(),
                  aggregateType.getName()));
        this.eventType = eventType;
        this.aggregateType = aggregateType;
    }
}
