package dk.cloudcreate.eventsourcing.aggregates.events;

import dk.cloudcreate.eventsourcing.aggregates.types.*;

import java.time.*;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Common envelope of {@link DomainEvent}'s and {@link Notification}'s.<br>
 * Events are immutable once constructed. The no-arguments constructor only exists so events can be deserialized.
 * Two events are equal when they share the same {@link EventId}.
 *
 * @param <ID> the type of aggregate id the event relates to
 */
public abstract class Event<ID extends AggregateId> {
    private EventId        eventId;
    private ID             aggregateId;
    private OffsetDateTime occurredOn;

    protected Event() {
    }

    protected Event(ID aggregateId) {
        this(aggregateId, EventId.random(), OffsetDateTime.now(ZoneOffset.UTC));
    }

    protected Event(ID aggregateId, EventId eventId, OffsetDateTime occurredOn) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.occurredOn = requireNonNull(occurredOn, "No occurredOn provided");
    }

    public EventId eventId() {
        return eventId;
    }

    public ID aggregateId() {
        return aggregateId;
    }

    public OffsetDateTime occurredOn() {
        return occurredOn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(eventId, ((Event<?>) o).eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }
}
