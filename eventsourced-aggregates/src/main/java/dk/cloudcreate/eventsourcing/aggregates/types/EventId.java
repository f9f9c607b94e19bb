package dk.cloudcreate.eventsourcing.aggregates.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * Unique identity of a single domain event or notification
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }
}
