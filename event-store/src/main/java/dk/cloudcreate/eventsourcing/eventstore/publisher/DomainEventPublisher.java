package dk.cloudcreate.eventsourcing.eventstore.publisher;

import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import reactor.core.publisher.Mono;

/**
 * Publishes domain events after they've been appended to the event store
 */
public interface DomainEventPublisher {
    Mono<Void> publish(DomainEvent<?> event);
}
