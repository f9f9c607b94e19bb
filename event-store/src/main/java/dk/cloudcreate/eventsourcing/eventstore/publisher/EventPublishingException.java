package dk.cloudcreate.eventsourcing.eventstore.publisher;

import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;

public class EventPublishingException extends EventStoreException {
    public EventPublishingException(String message) {
        super(message);
    }
}
