package dk.cloudcreate.eventsourcing.eventstore.accessor;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.aggregates.notifications.NotificationSourcing;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.Originator;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;
import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.publisher.*;
import org.slf4j.*;
import reactor.core.publisher.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link AggregateAccessor} backed by an {@link EventStore}.<br>
 * {@link #append(Aggregate)} appends the uncommitted events one at a time in order and publishes each event right after it
 * has been appended. The uncommitted events are only cleared after every event has been appended and published. For a
 * {@link NotificationSourcing} aggregate the pending notifications are then appended and published the same way before they
 * are cleared.<br>
 * A failure stops the append and is propagated. Events appended before the failure stay in the event store and have been
 * published, while the aggregate keeps all its uncommitted events, so retrying delivers those events at least once.
 *
 * @param <ID>        the aggregate id type
 * @param <AGGREGATE> the aggregate type
 */
public class DefaultAggregateAccessor<ID extends AggregateId, AGGREGATE extends Aggregate<ID, AGGREGATE>> implements AggregateAccessor<ID, AGGREGATE> {
    private static final Logger log = LoggerFactory.getLogger(DefaultAggregateAccessor.class);

    private final EventStore<ID>           eventStore;
    private final Class<AGGREGATE>         aggregateImplementationType;
    private final AggregateInstanceFactory aggregateInstanceFactory;
    private final DomainEventPublisher     domainEventPublisher;
    private final NotificationPublisher    notificationPublisher;

    public DefaultAggregateAccessor(EventStore<ID> eventStore,
                                    Class<AGGREGATE> aggregateImplementationType,
                                    AggregateInstanceFactory aggregateInstanceFactory,
                                    DomainEventPublisher domainEventPublisher,
                                    NotificationPublisher notificationPublisher) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "No aggregateImplementationType provided");
        this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "No aggregateInstanceFactory provided");
        this.domainEventPublisher = requireNonNull(domainEventPublisher, "No domainEventPublisher provided");
        this.notificationPublisher = requireNonNull(notificationPublisher, "No notificationPublisher provided");
    }

    /**
     * Accessor that creates aggregate instances using {@link AggregateInstanceFactory#defaultConstructorFactory()}
     * and publishes both events and notifications using the <code>publisher</code>
     */
    public DefaultAggregateAccessor(EventStore<ID> eventStore,
                                    Class<AGGREGATE> aggregateImplementationType,
                                    InProcessEventPublisher publisher) {
        this(eventStore, aggregateImplementationType, AggregateInstanceFactory.defaultConstructorFactory(), publisher, publisher);
    }

    @Override
    public Mono<Void> append(AGGREGATE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        return Mono.defer(() -> {
            var uncommittedEvents = aggregate.uncommittedEvents();
            log.debug("[{}] Appending {} event(s) for '{}' with id '{}'",
                      eventStore.aggregateType(),
                      uncommittedEvents.size(),
                      aggregateImplementationType.getSimpleName(),
                      aggregate.aggregateId());
            return Flux.fromIterable(uncommittedEvents)
                       .concatMap(event -> eventStore.appendEvent(event)
                                                     .then(Mono.defer(() -> domainEventPublisher.publish(event))))
                       .then(Mono.fromRunnable(aggregate::markEventsAsCommitted))
                       .then(Mono.defer(() -> appendNotifications(aggregate)));
        });
    }

    @SuppressWarnings("unchecked")
    private Mono<Void> appendNotifications(AGGREGATE aggregate) {
        if (!(aggregate instanceof NotificationSourcing)) {
            return Mono.empty();
        }
        var notificationSourcing = (NotificationSourcing<ID>) aggregate;
        var notifications        = notificationSourcing.notifications();
        if (notifications.isEmpty()) {
            return Mono.empty();
        }
        log.debug("[{}] Appending {} notification(s) for '{}' with id '{}'",
                  eventStore.aggregateType(),
                  notifications.size(),
                  aggregateImplementationType.getSimpleName(),
                  aggregate.aggregateId());
        return Flux.fromIterable(notifications)
                   .concatMap(notification -> eventStore.appendNotification(notification)
                                                        .then(Mono.defer(() -> notificationPublisher.publish(notification))))
                   .then(Mono.fromRunnable(notificationSourcing::markNotificationsAsCommitted));
    }

    @Override
    public Mono<AGGREGATE> read(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return eventStore.readAllEvents(aggregateId)
                         .collectList()
                         .flatMap(events -> {
                             if (events.isEmpty()) {
                                 log.debug("[{}] Didn't find any events for '{}' with id '{}'",
                                           eventStore.aggregateType(),
                                           aggregateImplementationType.getSimpleName(),
                                           aggregateId);
                                 return Mono.<AGGREGATE>empty();
                             }
                             log.trace("[{}] Loading '{}' with id '{}' from {} event(s)",
                                       eventStore.aggregateType(),
                                       aggregateImplementationType.getSimpleName(),
                                       aggregateId,
                                       events.size());
                             return Mono.just(newAggregateInstance().loadFromHistory(events));
                         });
    }

    @Override
    public Mono<AGGREGATE> load(ID aggregateId) {
        return read(aggregateId).switchIfEmpty(Mono.error(() -> new AggregateNotFoundException(aggregateId,
                                                                                               aggregateImplementationType,
                                                                                               eventStore.aggregateType())));
    }

    @Override
    public Mono<AGGREGATE> readFromSnapShot(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        if (!isOriginator()) {
            return Mono.error(notAnOriginator());
        }
        return eventStore.getSnapShot(aggregateId)
                         .flatMap(snapShot -> eventStore.readEventsAfter(aggregateId, snapShot.version())
                                                        .collectList()
                                                        .map(events -> {
                                                            log.trace("[{}] Loading '{}' with id '{}' from snapshot with version {} and {} later event(s)",
                                                                      eventStore.aggregateType(),
                                                                      aggregateImplementationType.getSimpleName(),
                                                                      aggregateId,
                                                                      snapShot.version(),
                                                                      events.size());
                                                            return newAggregateInstance().restoreFromSnapShot(snapShot)
                                                                                         .loadFromHistory(events);
                                                        }))
                         .switchIfEmpty(Mono.defer(() -> read(aggregateId)));
    }

    @Override
    public Mono<Void> appendAsSnapShot(AGGREGATE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        if (!isOriginator()) {
            return Mono.error(notAnOriginator());
        }
        return eventStore.appendSnapShot(aggregate);
    }

    @Override
    public Mono<Long> eventCountSinceLastSnapShot(ID aggregateId) {
        return eventStore.readEventCountSinceLastSnapShot(aggregateId);
    }

    private boolean isOriginator() {
        return Originator.class.isAssignableFrom(aggregateImplementationType);
    }

    private AggregateException notAnOriginator() {
        return new AggregateException(msg("Aggregate '{}' doesn't implement {} and doesn't support snapshots",
                                          aggregateImplementationType.getName(),
                                          Originator.class.getSimpleName()));
    }

    private AGGREGATE newAggregateInstance() {
        return aggregateInstanceFactory.create(aggregateImplementationType);
    }

    public Class<AGGREGATE> aggregateImplementationType() {
        return aggregateImplementationType;
    }

    @Override
    public String toString() {
        return "DefaultAggregateAccessor{" +
                "aggregateType=" + eventStore.aggregateType() +
                ", aggregateImplementationType=" + aggregateImplementationType.getName() +
                '}';
    }
}
