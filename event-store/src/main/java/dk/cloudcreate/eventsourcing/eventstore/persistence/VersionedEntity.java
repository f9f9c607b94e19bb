package dk.cloudcreate.eventsourcing.eventstore.persistence;

/**
 * An {@link EventStoreEntity} that belongs to a specific version of its aggregate
 */
public interface VersionedEntity {
    long version();
}
