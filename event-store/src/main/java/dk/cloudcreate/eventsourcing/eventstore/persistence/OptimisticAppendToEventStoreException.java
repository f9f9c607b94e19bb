package dk.cloudcreate.eventsourcing.eventstore.persistence;

/**
 * Thrown when a domain event couldn't be appended because another event with the same aggregate id and version
 * has already been appended, i.e. a concurrent writer modified the same aggregate
 */
public class OptimisticAppendToEventStoreException extends AppendToEventStoreException {
    public OptimisticAppendToEventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public OptimisticAppendToEventStoreException(String message) {
        super(message);
    }
}
