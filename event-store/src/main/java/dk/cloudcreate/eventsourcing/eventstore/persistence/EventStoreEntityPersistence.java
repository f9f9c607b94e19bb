package dk.cloudcreate.eventsourcing.eventstore.persistence;

import java.util.stream.Stream;

/**
 * Storage collaborator of the {@link dk.cloudcreate.eventsourcing.eventstore.EventStore}. Implementations store
 * {@link DomainEventEntity}, {@link NotificationEntity} and {@link SnapShotEntity} rows.<br>
 * <br>
 * Ordering contract for {@link #query(Class, EventStoreEntityCriteria)}: {@link VersionedEntity}'s are ordered by version and
 * then insertion order, all other entities by insertion order. The order is descending when
 * {@link EventStoreEntityCriteria#isNewestFirst()} and ascending otherwise.<br>
 * <br>
 * Implementations must reject a {@link DomainEventEntity} that has the same aggregate type, aggregate id and version
 * as an already stored one with an {@link OptimisticAppendToEventStoreException}.
 */
public interface EventStoreEntityPersistence {
    /**
     * @param entity the entity to store
     * @throws OptimisticAppendToEventStoreException if a domain event with the same aggregate id and version already exists
     * @throws AppendToEventStoreException           if the entity couldn't be stored
     */
    <ENTITY extends EventStoreEntity> void insert(ENTITY entity);

    /**
     * @param entityType the type of entities to query
     * @param criteria   the criteria the entities must match
     * @return the matching entities, ordered as described by the class documentation and limited to
     * {@link EventStoreEntityCriteria#count()} entities
     */
    <ENTITY extends EventStoreEntity> Stream<ENTITY> query(Class<ENTITY> entityType, EventStoreEntityCriteria criteria);

    /**
     * @return the number of entities matching the criteria ({@link EventStoreEntityCriteria#count()} is ignored)
     */
    <ENTITY extends EventStoreEntity> long count(Class<ENTITY> entityType, EventStoreEntityCriteria criteria);

    /**
     * @return true if an entity with the given id was deleted
     */
    <ENTITY extends EventStoreEntity> boolean delete(Class<ENTITY> entityType, String entityId);
}
