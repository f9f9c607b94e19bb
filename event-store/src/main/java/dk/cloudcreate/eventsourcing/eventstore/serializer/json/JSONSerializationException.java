package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
