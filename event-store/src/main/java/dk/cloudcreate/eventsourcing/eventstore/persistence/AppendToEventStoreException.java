package dk.cloudcreate.eventsourcing.eventstore.persistence;

import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;

/**
 * Thrown when an entity couldn't be appended to the event store
 */
public class AppendToEventStoreException extends EventStoreException {
    public AppendToEventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public AppendToEventStoreException(String message) {
        super(message);
    }
}
