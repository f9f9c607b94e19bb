package dk.cloudcreate.eventsourcing.aggregates.events;

import dk.cloudcreate.eventsourcing.aggregates.notifications.NotificationSourcing;
import dk.cloudcreate.eventsourcing.aggregates.types.*;

import java.time.OffsetDateTime;

/**
 * Integration event queued by an aggregate for outbox style publishing, after its
 * {@link DomainEvent}'s have been appended and published.
 *
 * @param <ID> the type of aggregate id the notification relates to
 * @see NotificationSourcing
 */
public abstract class Notification<ID extends AggregateId> extends Event<ID> {
    protected Notification() {
    }

    protected Notification(ID aggregateId) {
        super(aggregateId);
    }

    protected Notification(ID aggregateId, EventId eventId, OffsetDateTime occurredOn) {
        super(aggregateId, eventId, occurredOn);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId() +
                ", eventId=" + eventId() +
                ", occurredOn=" + occurredOn() +
                '}';
    }
}
