package dk.cloudcreate.eventsourcing.eventstore;

import dk.cloudcreate.essentials.types.LongRange;
import dk.cloudcreate.eventsourcing.aggregates.Aggregate;
import dk.cloudcreate.eventsourcing.aggregates.events.*;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.SnapShot;
import dk.cloudcreate.eventsourcing.aggregates.types.*;
import dk.cloudcreate.eventsourcing.eventstore.persistence.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONSerializer;
import org.slf4j.*;
import reactor.core.publisher.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link EventStore} that converts between events/snapshots and {@link EventStoreEntity}'s and delegates the storage
 * to an {@link EventStoreEntityPersistence}.<br>
 * The persistence calls run on the thread that subscribes.
 *
 * @param <ID> the aggregate id type
 */
public class DefaultEventStore<ID extends AggregateId> implements EventStore<ID> {
    private static final Logger log = LoggerFactory.getLogger(DefaultEventStore.class);

    private final AggregateType               aggregateType;
    private final JSONSerializer              jsonSerializer;
    private final EventStoreEntityPersistence persistence;

    public DefaultEventStore(EventStoreConfiguration configuration, EventStoreEntityPersistence persistence) {
        requireNonNull(configuration, "No configuration provided");
        this.aggregateType = configuration.aggregateType;
        this.jsonSerializer = configuration.jsonSerializer;
        this.persistence = requireNonNull(persistence, "No persistence provided");
    }

    @Override
    public AggregateType aggregateType() {
        return aggregateType;
    }

    @Override
    public Mono<Void> appendEvent(DomainEvent<ID> event) {
        requireNonNull(event, "No event provided");
        return Mono.fromRunnable(() -> {
            log.debug("[{}] Appending '{}' with version {} for aggregate with id '{}'",
                      aggregateType,
                      event.getClass().getSimpleName(),
                      event.version(),
                      event.aggregateId());
            persistence.insert(DomainEventEntity.from(event, aggregateType, jsonSerializer));
        });
    }

    @Override
    public Mono<Void> appendNotification(Notification<ID> notification) {
        requireNonNull(notification, "No notification provided");
        return Mono.fromRunnable(() -> {
            log.debug("[{}] Appending notification '{}' for aggregate with id '{}'",
                      aggregateType,
                      notification.getClass().getSimpleName(),
                      notification.aggregateId());
            persistence.insert(NotificationEntity.from(notification, aggregateType, jsonSerializer));
        });
    }

    @Override
    public Flux<DomainEvent<ID>> readAllEvents(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return readEvents(criteriaFor(aggregateId).build());
    }

    @Override
    public Flux<DomainEvent<ID>> readEventsAfter(ID aggregateId, AggregateVersion version) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(version, "No version provided");
        return readEvents(criteriaFor(aggregateId).versionRange(LongRange.from(version.longValue() + 1))
                                                  .build());
    }

    private Flux<DomainEvent<ID>> readEvents(EventStoreEntityCriteria criteria) {
        return readStoreEntities(DomainEventEntity.class, criteria)
                .map(entity -> entity.<ID>toEvent(jsonSerializer));
    }

    @Override
    public <ENTITY extends EventStoreEntity> Flux<ENTITY> readStoreEntities(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(criteria, "No criteria provided");
        return Flux.defer(() -> {
            var scopedCriteria = scoped(criteria);
            log.trace("[{}] Reading {}'s matching {}", aggregateType, entityType.getSimpleName(), scopedCriteria);
            return Flux.fromStream(persistence.query(entityType, scopedCriteria));
        });
    }

    @Override
    public <ENTITY extends EventStoreEntity> Mono<Long> countStoreEntities(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(criteria, "No criteria provided");
        return Mono.fromCallable(() -> persistence.count(entityType, scoped(criteria)));
    }

    @Override
    public Flux<Notification<ID>> readNotifications(EventStoreEntityCriteria criteria) {
        return readStoreEntities(NotificationEntity.class, criteria)
                .map(entity -> entity.<ID>toNotification(jsonSerializer));
    }

    @Override
    public Mono<SnapShot<ID>> getSnapShot(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var criteria = criteriaFor(aggregateId).active(true)
                                               .deleted(false)
                                               .newestFirst(true)
                                               .count(1)
                                               .build();
        return readStoreEntities(SnapShotEntity.class, criteria)
                .next()
                .map(entity -> entity.toSnapShot(aggregateId, jsonSerializer));
    }

    @Override
    public Mono<Void> appendSnapShot(Aggregate<ID, ?> aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        return Mono.fromRunnable(() -> {
            var snapShot = SnapShot.of(aggregate);
            var existing = criteriaFor(snapShot.aggregateId()).versionRange(LongRange.only(snapShot.version().longValue()))
                                                               .build();
            persistence.query(SnapShotEntity.class, scoped(existing))
                       .forEach(superseded -> {
                           log.debug("[{}] Replacing snapshot '{}' with version {} for aggregate with id '{}'",
                                     aggregateType,
                                     superseded.entityId(),
                                     superseded.version(),
                                     superseded.aggregateId());
                           persistence.delete(SnapShotEntity.class, superseded.entityId());
                       });
            log.debug("[{}] Appending snapshot with version {} for aggregate with id '{}'", aggregateType, snapShot.version(), snapShot.aggregateId());
            persistence.insert(SnapShotEntity.from(snapShot, aggregateType, jsonSerializer));
        });
    }

    @Override
    public Flux<DomainEvent<ID>> readEventsSinceLastSnapShot(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return lastSnapShotVersion(aggregateId).flatMapMany(version -> readEventsAfter(aggregateId, version));
    }

    @Override
    public Mono<Long> readEventCountSinceLastSnapShot(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return lastSnapShotVersion(aggregateId).flatMap(version -> countStoreEntities(DomainEventEntity.class,
                                                                                      criteriaFor(aggregateId).versionRange(LongRange.from(version.longValue() + 1))
                                                                                                              .build()));
    }

    private Mono<AggregateVersion> lastSnapShotVersion(ID aggregateId) {
        return getSnapShot(aggregateId).map(SnapShot::version)
                                       .defaultIfEmpty(AggregateVersion.NO_EVENTS_APPLIED);
    }

    private EventStoreEntityCriteria.Builder criteriaFor(ID aggregateId) {
        return EventStoreEntityCriteria.builder()
                                       .aggregateId(aggregateId.toString());
    }

    private EventStoreEntityCriteria scoped(EventStoreEntityCriteria criteria) {
        return criteria.toBuilder()
                       .aggregateType(aggregateType.toString())
                       .build();
    }

    @Override
    public String toString() {
        return "DefaultEventStore{" +
                "aggregateType=" + aggregateType +
                ", persistence=" + persistence.getClass().getSimpleName() +
                '}';
    }
}
