package dk.cloudcreate.eventsourcing.eventstore;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;

import java.util.UUID;

public class ContactId extends AggregateId {
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ContactId(UUID value) {
        super(value);
    }

    public static ContactId random() {
        return new ContactId(UUID.randomUUID());
    }
}
