package dk.cloudcreate.eventsourcing.aggregates;

/**
 * Base type for errors caused by how an aggregate is wired or used
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
