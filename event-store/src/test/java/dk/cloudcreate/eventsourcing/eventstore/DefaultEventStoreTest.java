package dk.cloudcreate.eventsourcing.eventstore;

import com.fasterxml.jackson.databind.JsonNode;
import dk.cloudcreate.essentials.types.LongRange;
import dk.cloudcreate.eventsourcing.aggregates.AggregateException;
import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateVersion;
import dk.cloudcreate.eventsourcing.eventstore.ContactEvents.*;
import dk.cloudcreate.eventsourcing.eventstore.persistence.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;
import org.junit.jupiter.api.*;

import java.time.*;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DefaultEventStore using InMemoryEventStoreEntityPersistence")
class DefaultEventStoreTest {
    private static final AggregateType CONTACTS = AggregateType.of("Contacts");

    private EventStoreConfiguration        configuration;
    private DefaultEventStore<ContactId>   eventStore;

    @BeforeEach
    void setup() {
        configuration = EventStoreConfiguration.standardConfigurationUsingJackson(CONTACTS);
        eventStore = new DefaultEventStore<>(configuration, new InMemoryEventStoreEntityPersistence(configuration.jsonSerializer));
    }

    @Test
    void reading_an_aggregate_without_events_completes_empty() {
        assertThat(eventStore.readAllEvents(ContactId.random()).collectList().block()).isEmpty();
        assertThat(eventStore.getSnapShot(ContactId.random()).blockOptional()).isEmpty();
    }

    @Test
    void appended_events_are_read_back_in_version_order() {
        // Given
        var contactId = ContactId.random();
        var otherId   = ContactId.random();
        eventStore.appendEvent(new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com")).block();
        eventStore.appendEvent(new ContactCreated(otherId, AggregateVersion.of(0), "Bob", "bob@example.com")).block();
        eventStore.appendEvent(new ContactVerified(contactId, AggregateVersion.of(2))).block();
        eventStore.appendEvent(new EmailChanged(contactId, AggregateVersion.of(1), "ann@example.org")).block();

        // When
        var events = eventStore.readAllEvents(contactId).collectList().block();

        // Then
        assertThat(events).extracting(DomainEvent::version)
                          .containsExactly(AggregateVersion.of(0), AggregateVersion.of(1), AggregateVersion.of(2));
        assertThat(events).allMatch(event -> event.aggregateId().equals(contactId));
        var created = (ContactCreated) events.get(0);
        assertThat(created.name()).isEqualTo("Ann");
        assertThat(created.email()).isEqualTo("ann@example.com");
        assertThat(((EmailChanged) events.get(1)).email()).isEqualTo("ann@example.org");
    }

    @Test
    void a_read_event_keeps_its_identity_and_occurrence_time() {
        // Given
        var contactId = ContactId.random();
        var created   = new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com");
        eventStore.appendEvent(created).block();

        // When
        var read = eventStore.readAllEvents(contactId).blockFirst();

        // Then
        assertThat(read).isEqualTo(created);
        assertThat(read.eventId()).isEqualTo(created.eventId());
        assertThat(read.occurredOn()).isEqualTo(created.occurredOn());
    }

    @Test
    void appending_the_same_version_twice_fails_with_an_optimistic_exception() {
        // Given
        var contactId = ContactId.random();
        eventStore.appendEvent(new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com")).block();

        // When / Then
        assertThatThrownBy(() -> eventStore.appendEvent(new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com")).block())
                .isInstanceOf(OptimisticAppendToEventStoreException.class);
        assertThat(eventStore.readAllEvents(contactId).collectList().block()).hasSize(1);
    }

    @Test
    void nothing_is_appended_until_subscribed() {
        // Given
        var contactId = ContactId.random();

        // When
        eventStore.appendEvent(new ContactCreated(contactId, AggregateVersion.of(0), "Ann", "ann@example.com"));

        // Then
        assertThat(eventStore.readAllEvents(contactId).collectList().block()).isEmpty();
    }

    @Test
    void events_after_a_version_are_read() {
        // Given
        var contactId = ContactId.random();
        appendContactHistory(contactId);

        // When
        var events = eventStore.readEventsAfter(contactId, AggregateVersion.of(0)).collectList().block();

        // Then
        assertThat(events).extracting(DomainEvent::version)
                          .containsExactly(AggregateVersion.of(1), AggregateVersion.of(2));
    }

    @Test
    void the_latest_snapshot_supersedes_older_snapshots() {
        // Given
        var contactId = ContactId.random();
        var contact   = new Contact(contactId, "Ann", "ann@example.com");
        eventStore.appendSnapShot(contact).block();
        contact.changeEmail("ann@example.org");
        eventStore.appendSnapShot(contact).block();

        // When
        var snapShot = eventStore.getSnapShot(contactId).block();

        // Then
        assertThat(snapShot).isNotNull();
        assertThat(snapShot.aggregateId()).isEqualTo(contactId);
        assertThat(snapShot.version()).isEqualTo(AggregateVersion.of(1));
        var memento = (ContactMemento) snapShot.memento();
        assertThat(memento.email).isEqualTo("ann@example.org");
        assertThat(memento.name).isEqualTo("Ann");
    }

    @Test
    void a_snapshot_with_the_same_version_replaces_the_existing_one() {
        // Given
        var contactId = ContactId.random();
        var contact   = new Contact(contactId, "Ann", "ann@example.com");
        eventStore.appendSnapShot(contact).block();

        // When
        eventStore.appendSnapShot(contact).block();

        // Then
        assertThat(eventStore.countStoreEntities(SnapShotEntity.class, EventStoreEntityCriteria.builder()
                                                                                               .aggregateId(contactId.toString())
                                                                                               .build())
                             .block()).isEqualTo(1L);
    }

    @Test
    void events_since_the_last_snapshot() {
        // Given
        var contactId = ContactId.random();
        var contact   = new Contact(contactId, "Ann", "ann@example.com");
        contact.changeEmail("ann@example.org");
        contact.uncommittedEvents().forEach(event -> eventStore.appendEvent(event).block());
        contact.markEventsAsCommitted();
        eventStore.appendSnapShot(contact).block();
        contact.verify();
        contact.uncommittedEvents().forEach(event -> eventStore.appendEvent(event).block());

        // When
        var sinceSnapShot = eventStore.readEventsSinceLastSnapShot(contactId).collectList().block();
        var count         = eventStore.readEventCountSinceLastSnapShot(contactId).block();

        // Then
        assertThat(sinceSnapShot).hasSize(1);
        assertThat(sinceSnapShot.get(0)).isInstanceOf(ContactVerified.class);
        assertThat(sinceSnapShot.get(0).version()).isEqualTo(AggregateVersion.of(2));
        assertThat(count).isEqualTo(1L);
    }

    @Test
    void without_a_snapshot_all_events_count_as_since_the_last_snapshot() {
        // Given
        var contactId = ContactId.random();
        appendContactHistory(contactId);

        // Then
        assertThat(eventStore.readEventsSinceLastSnapShot(contactId).collectList().block()).hasSize(3);
        assertThat(eventStore.readEventCountSinceLastSnapShot(contactId).block()).isEqualTo(3L);
    }

    @Test
    void appending_a_snapshot_of_an_aggregate_that_is_not_an_originator_fails() {
        // Given
        var aggregate = new NotAnOriginator(ContactId.random());

        // When / Then
        assertThatThrownBy(() -> eventStore.appendSnapShot(aggregate).block())
                .isInstanceOf(AggregateException.class);
    }

    @Test
    void store_entities_can_be_queried_by_event_type_and_event_data() {
        // Given
        var contactId = ContactId.random();
        appendContactHistory(contactId);

        // When
        var emailChanges = eventStore.readStoreEntities(DomainEventEntity.class,
                                                        EventStoreEntityCriteria.builder()
                                                                                .aggregateId(contactId.toString())
                                                                                .eventTypeNamePattern("Email.*")
                                                                                .build())
                                     .collectList()
                                     .block();
        var orgEmails = eventStore.readStoreEntities(DomainEventEntity.class,
                                                     EventStoreEntityCriteria.builder()
                                                                             .eventDataPredicate(json -> json.path("email").asText().endsWith(".org"))
                                                                             .build())
                                  .collectList()
                                  .block();

        // Then
        assertThat(emailChanges).hasSize(1);
        assertThat(emailChanges.get(0).eventTypeName()).isEqualTo("EmailChanged");
        assertThat(emailChanges.get(0).eventTypeFullName()).isEqualTo(EmailChanged.class.getName());
        assertThat(emailChanges.get(0).aggregateTypeName()).isEqualTo("Contacts");
        assertThat(orgEmails).extracting(DomainEventEntity::version).containsExactly(1L);
    }

    @Test
    void store_entities_can_be_limited_and_read_newest_first() {
        // Given
        var contactId = ContactId.random();
        appendContactHistory(contactId);

        // When
        var newest = eventStore.readStoreEntities(DomainEventEntity.class,
                                                  EventStoreEntityCriteria.builder()
                                                                          .aggregateId(contactId.toString())
                                                                          .newestFirst(true)
                                                                          .count(2)
                                                                          .build())
                               .collectList()
                               .block();
        var range = eventStore.readStoreEntities(DomainEventEntity.class,
                                                 EventStoreEntityCriteria.builder()
                                                                         .aggregateId(contactId.toString())
                                                                         .versionRange(LongRange.between(1, 2))
                                                                         .build())
                              .collectList()
                              .block();

        // Then
        assertThat(newest).extracting(DomainEventEntity::version).containsExactly(2L, 1L);
        assertThat(range).extracting(DomainEventEntity::version).containsExactly(1L, 2L);
    }

    @Test
    void store_entities_are_scoped_to_the_aggregate_type() {
        // Given
        var otherStore = new DefaultEventStore<ContactId>(new EventStoreConfiguration(AggregateType.of("Leads"), configuration.jsonSerializer),
                                                          new InMemoryEventStoreEntityPersistence(configuration.jsonSerializer));
        var contactId  = ContactId.random();
        appendContactHistory(contactId);

        // Then
        assertThat(otherStore.readAllEvents(contactId).collectList().block()).isEmpty();
        assertThat(eventStore.countStoreEntities(DomainEventEntity.class, EventStoreEntityCriteria.all()).block()).isEqualTo(3L);
    }

    @Test
    void store_entities_can_be_filtered_on_creation_time() {
        // Given
        var before    = OffsetDateTime.now(ZoneOffset.UTC).minusMinutes(1);
        var contactId = ContactId.random();
        appendContactHistory(contactId);

        // Then
        assertThat(eventStore.countStoreEntities(DomainEventEntity.class,
                                                 EventStoreEntityCriteria.builder()
                                                                         .createdOn(before, null)
                                                                         .build()).block()).isEqualTo(3L);
        assertThat(eventStore.countStoreEntities(DomainEventEntity.class,
                                                 EventStoreEntityCriteria.builder()
                                                                         .createdOn(null, before)
                                                                         .build()).block()).isZero();
    }

    @Test
    void appended_notifications_are_read_in_insertion_order() {
        // Given
        var contactId = ContactId.random();
        var first     = new ContactVerifiedNotification(contactId, "ann@example.com");
        var second    = new ContactVerifiedNotification(contactId, "ann@example.org");
        eventStore.appendNotification(first).block();
        eventStore.appendNotification(second).block();

        // When
        var notifications = eventStore.readNotifications(EventStoreEntityCriteria.builder()
                                                                                 .aggregateId(contactId.toString())
                                                                                 .build())
                                      .collectList()
                                      .block();

        // Then
        assertThat(notifications).containsExactly(first, second);
        assertThat(((ContactVerifiedNotification) notifications.get(1)).email()).isEqualTo("ann@example.org");
    }

    @Test
    void reading_an_event_whose_type_no_longer_exists_fails() {
        // Given
        var persistence = new InMemoryEventStoreEntityPersistence(configuration.jsonSerializer);
        var store       = new DefaultEventStore<ContactId>(configuration, persistence);
        var contactId   = ContactId.random();
        persistence.insert(new DomainEventEntity(EventStoreEntity.newEntityId(),
                                                 "event-1",
                                                 contactId.toString(),
                                                 CONTACTS.toString(),
                                                 0,
                                                 "dk.cloudcreate.eventsourcing.eventstore.RemovedEvent",
                                                 "RemovedEvent",
                                                 "{}",
                                                 OffsetDateTime.now(ZoneOffset.UTC),
                                                 null,
                                                 true,
                                                 false));

        // When / Then
        assertThatThrownBy(() -> store.readAllEvents(contactId).blockLast())
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("RemovedEvent");
    }

    private void appendContactHistory(ContactId contactId) {
        var contact = new Contact(contactId, "Ann", "ann@example.com");
        contact.changeEmail("ann@example.org");
        contact.verify();
        contact.uncommittedEvents().forEach(event -> eventStore.appendEvent(event).block());
        contact.markEventsAsCommitted();
    }

    private static class NotAnOriginator extends dk.cloudcreate.eventsourcing.aggregates.AggregateRoot<ContactId, NotAnOriginator> {
        NotAnOriginator(ContactId contactId) {
            raiseEvent(new ContactCreated(contactId, newVersion(), "Ann", "ann@example.com"));
        }

        @Override
        protected void registerEventHandlers() {
            registerEventHandler(ContactCreated.class, e -> {
            });
        }
    }
}
