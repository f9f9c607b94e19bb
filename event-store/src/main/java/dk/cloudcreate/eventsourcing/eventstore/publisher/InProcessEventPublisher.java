package dk.cloudcreate.eventsourcing.eventstore.publisher;

import dk.cloudcreate.eventsourcing.aggregates.events.*;
import org.slf4j.*;
import reactor.core.publisher.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Publishes domain events and notifications to the in-process subscribers of {@link #events()}.<br>
 * Subscribers receive the events on the publishing thread. Events published while nobody is subscribed are dropped.
 * <pre>{@code
 * var publisher = new InProcessEventPublisher();
 * publisher.events(OrderAccepted.class)
 *          .subscribe(event -> log.info("Order {} accepted", event.aggregateId()));
 * }</pre>
 */
public class InProcessEventPublisher implements DomainEventPublisher, NotificationPublisher {
    private static final Logger log = LoggerFactory.getLogger(InProcessEventPublisher.class);

    private final Sinks.Many<Event<?>> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public Mono<Void> publish(DomainEvent<?> event) {
        requireNonNull(event, "No event provided");
        return Mono.fromRunnable(() -> emit(event));
    }

    @Override
    public Mono<Void> publish(Notification<?> notification) {
        requireNonNull(notification, "No notification provided");
        return Mono.fromRunnable(() -> emit(notification));
    }

    private synchronized void emit(Event<?> event) {
        var result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.trace("No subscribers for '{}' with id '{}'", event.getClass().getSimpleName(), event.eventId());
        } else if (result.isFailure()) {
            throw new EventPublishingException(msg("Failed to publish '{}' with id '{}': {}",
                                                   event.getClass().getSimpleName(),
                                                   event.eventId(),
                                                   result));
        } else {
            log.trace("Published '{}' with id '{}'", event.getClass().getSimpleName(), event.eventId());
        }
    }

    /**
     * @return every published domain event and notification
     */
    public Flux<Event<?>> events() {
        return sink.asFlux();
    }

    /**
     * @return the published events of the given type
     */
    public <E extends Event<?>> Flux<E> events(Class<E> eventType) {
        return events().ofType(eventType);
    }
}
