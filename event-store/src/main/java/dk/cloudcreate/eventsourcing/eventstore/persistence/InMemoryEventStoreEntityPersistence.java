package dk.cloudcreate.eventsourcing.eventstore.persistence;

import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONSerializer;
import org.slf4j.*;

import java.util.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStoreEntityPersistence} that keeps all entities in memory. Safe for use from multiple threads.
 */
public class InMemoryEventStoreEntityPersistence implements EventStoreEntityPersistence {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStoreEntityPersistence.class);

    private final JSONSerializer                                    jsonSerializer;
    /**
     * Key: entity type<br>
     * Value: the entities of that type in insertion order
     */
    private final Map<Class<? extends EventStoreEntity>, List<EventStoreEntity>> entities = new HashMap<>();

    /**
     * @param jsonSerializer used to parse payloads when a query has an event data predicate
     */
    public InMemoryEventStoreEntityPersistence(JSONSerializer jsonSerializer) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    @Override
    public synchronized <ENTITY extends EventStoreEntity> void insert(ENTITY entity) {
        requireNonNull(entity, "No entity provided");
        var table = entities.computeIfAbsent(entity.getClass(), type -> new ArrayList<>());
        if (table.stream().anyMatch(existing -> existing.entityId().equals(entity.entityId()))) {
            throw new AppendToEventStoreException(msg("[{}] An entity with id '{}' already exists", entity.aggregateTypeName(), entity.entityId()));
        }
        if (entity instanceof DomainEventEntity) {
            var event = (DomainEventEntity) entity;
            var conflict = table.stream()
                                .map(DomainEventEntity.class::cast)
                                .anyMatch(existing -> existing.aggregateTypeName().equals(event.aggregateTypeName()) &&
                                        existing.aggregateId().equals(event.aggregateId()) &&
                                        existing.version() == event.version());
            if (conflict) {
                throw new OptimisticAppendToEventStoreException(msg("[{}] An event with version {} has already been appended for aggregate with id '{}'",
                                                                    event.aggregateTypeName(),
                                                                    event.version(),
                                                                    event.aggregateId()));
            }
        }
        table.add(entity);
        log.trace("[{}] Stored {} with id '{}'", entity.aggregateTypeName(), entity.getClass().getSimpleName(), entity.entityId());
    }

    @Override
    public synchronized <ENTITY extends EventStoreEntity> Stream<ENTITY> query(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(criteria, "No criteria provided");
        var matching = matching(entityType, criteria);
        if (VersionedEntity.class.isAssignableFrom(entityType)) {
            // stable sort keeps insertion order for equal versions
            matching.sort(Comparator.comparingLong(entity -> ((VersionedEntity) entity).version()));
        }
        if (criteria.isNewestFirst()) {
            Collections.reverse(matching);
        }
        var result = criteria.count().isPresent() ? matching.subList(0, Math.min(criteria.count().get(), matching.size())) : matching;
        return List.copyOf(result).stream();
    }

    @Override
    public synchronized <ENTITY extends EventStoreEntity> long count(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(criteria, "No criteria provided");
        return matching(entityType, criteria).size();
    }

    @Override
    public synchronized <ENTITY extends EventStoreEntity> boolean delete(Class<ENTITY> entityType, String entityId) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(entityId, "No entityId provided");
        var table = entities.get(entityType);
        return table != null && table.removeIf(entity -> entity.entityId().equals(entityId));
    }

    private <ENTITY extends EventStoreEntity> List<ENTITY> matching(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        return entities.getOrDefault(entityType, List.of())
                       .stream()
                       .filter(entity -> criteria.matches(entity, jsonSerializer::readTree))
                       .map(entityType::cast)
                       .collect(Collectors.toCollection(ArrayList::new));
    }
}
