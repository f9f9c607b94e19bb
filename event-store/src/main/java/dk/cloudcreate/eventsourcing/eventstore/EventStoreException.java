package dk.cloudcreate.eventsourcing.eventstore;

/**
 * Base type for failures raised by an {@link EventStore} or its storage collaborators
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
