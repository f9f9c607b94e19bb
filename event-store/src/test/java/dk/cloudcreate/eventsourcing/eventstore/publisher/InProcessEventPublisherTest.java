package dk.cloudcreate.eventsourcing.eventstore.publisher;

import dk.cloudcreate.eventsourcing.aggregates.events.Event;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateVersion;
import dk.cloudcreate.eventsourcing.eventstore.ContactEvents.*;
import dk.cloudcreate.eventsourcing.eventstore.ContactId;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InProcessEventPublisher")
class InProcessEventPublisherTest {
    private final InProcessEventPublisher publisher = new InProcessEventPublisher();

    @Test
    void subscribers_receive_events_and_notifications_in_publishing_order() {
        // Given
        var received  = new ArrayList<Event<?>>();
        var contactId = ContactId.random();
        var created   = new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com");
        var verified  = new ContactVerifiedNotification(contactId, "ann@example.com");
        publisher.events().subscribe(received::add);

        // When
        publisher.publish(created).block();
        publisher.publish(verified).block();

        // Then
        assertThat(received).containsExactly(created, verified);
    }

    @Test
    void subscribers_can_subscribe_to_a_single_event_type() {
        // Given
        var received  = new ArrayList<ContactVerifiedNotification>();
        var contactId = ContactId.random();
        publisher.events(ContactVerifiedNotification.class).subscribe(received::add);

        // When
        publisher.publish(new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com")).block();
        publisher.publish(new ContactVerifiedNotification(contactId, "ann@example.com")).block();

        // Then
        assertThat(received).hasSize(1);
        assertThat(received.get(0).email()).isEqualTo("ann@example.com");
    }

    @Test
    void publishing_without_subscribers_is_not_an_error() {
        assertThatCode(() -> publisher.publish(new ContactVerifiedNotification(ContactId.random(), "ann@example.com")).block())
                .doesNotThrowAnyException();
    }

    @Test
    void a_subscriber_that_disposed_its_subscription_receives_nothing() {
        // Given
        var received     = new ArrayList<Event<?>>();
        var subscription = publisher.events().subscribe(received::add);

        // When
        subscription.dispose();
        publisher.publish(new ContactVerifiedNotification(ContactId.random(), "ann@example.com")).block();

        // Then
        assertThat(received).isEmpty();
    }
}
