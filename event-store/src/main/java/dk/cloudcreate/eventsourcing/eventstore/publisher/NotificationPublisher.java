package dk.cloudcreate.eventsourcing.eventstore.publisher;

import dk.cloudcreate.eventsourcing.aggregates.events.Notification;
import reactor.core.publisher.Mono;

/**
 * Publishes notifications after they've been appended to the notification outbox
 */
public interface NotificationPublisher {
    Mono<Void> publish(Notification<?> notification);
}
