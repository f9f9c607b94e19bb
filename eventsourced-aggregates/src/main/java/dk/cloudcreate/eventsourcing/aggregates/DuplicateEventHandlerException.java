package dk.cloudcreate.eventsourcing.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate registers more than one handler for the same event type
 */
public class DuplicateEventHandlerException extends AggregateException {
    public final Class<?> eventType;

    public DuplicateEventHandlerException(Class<?> eventType, Class<?> aggregateType) {
        super(msg("An event handler for '{}' has already been registered in aggregate '{}'",
                  eventType.getName(),
                  aggregateType.getName()));
        this.eventType = eventType;
    }
}
