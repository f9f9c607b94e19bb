package dk.cloudcreate.eventsourcing.eventstore;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.Memento;

public class ContactMemento implements Memento {
    public final String  name;
    public final String  email;
    public final boolean verified;

    @JsonCreator
    public ContactMemento(@JsonProperty("name") String name,
                          @JsonProperty("email") String email,
                          @JsonProperty("verified") boolean verified) {
        this.name = name;
        this.email = email;
        this.verified = verified;
    }
}
