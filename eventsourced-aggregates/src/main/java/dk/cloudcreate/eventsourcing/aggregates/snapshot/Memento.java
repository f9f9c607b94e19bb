package dk.cloudcreate.eventsourcing.aggregates.snapshot;

/**
 * Marker for a serializable capture of an aggregate's internal state
 *
 * @see Originator
 */
public interface Memento {
}
